package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.DataKind;
import com.climbwatch.occupancy.model.OccupancyReading;
import com.climbwatch.occupancy.store.BranchStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Reads stored branch data for the HTTP layer. Every call goes to the store; nothing is cached.
 */
@Service
@RequiredArgsConstructor
public class BranchQueryService {

    private final BranchStore store;

    public Map<String, List<OccupancyReading>> occupancy() {
        return store.readOccupancy();
    }

    public Map<String, List<AttendanceSlot>> attendance() {
        return store.readAttendance();
    }

    public Map<String, ? extends List<?>> getCurrentState(DataKind kind) {
        return switch (kind) {
            case OCCUPANCY -> occupancy();
            case ATTENDANCE -> attendance();
        };
    }

    public String storageMode() {
        return store.describe();
    }
}
