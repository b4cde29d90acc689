package com.climbwatch.occupancy.store;

import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.Branch;
import com.climbwatch.occupancy.model.OccupancyReading;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local store used when no database is configured.
 *
 * One read/write lock guards both maps; readers always get copies. Occupancy history
 * grows without bound for the life of the process, there is no eviction.
 */
@Slf4j
public class InMemoryBranchStore implements BranchStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Branch, List<OccupancyReading>> occupancy = new EnumMap<>(Branch.class);
    private final Map<Branch, List<AttendanceSlot>> attendance = new EnumMap<>(Branch.class);

    public InMemoryBranchStore() {
        for (Branch branch : Branch.values()) {
            occupancy.put(branch, new ArrayList<>());
            attendance.put(branch, new ArrayList<>());
        }
    }

    @Override
    public void recordOccupancy(Branch branch, OccupancyReading reading) {
        lock.writeLock().lock();
        try {
            occupancy.get(branch).add(reading);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Recorded occupancy for {} in memory", branch.branchName());
    }

    @Override
    public void replaceAttendance(Branch branch, List<AttendanceSlot> slots) {
        lock.writeLock().lock();
        try {
            attendance.put(branch, new ArrayList<>(slots));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Replaced {} attendance slots for {} in memory", slots.size(), branch.branchName());
    }

    @Override
    public Map<String, List<OccupancyReading>> readOccupancy() {
        return snapshot(occupancy);
    }

    @Override
    public Map<String, List<AttendanceSlot>> readAttendance() {
        return snapshot(attendance);
    }

    @Override
    public String describe() {
        return "memory";
    }

    private <T> Map<String, List<T>> snapshot(Map<Branch, List<T>> source) {
        lock.readLock().lock();
        try {
            Map<String, List<T>> copy = new LinkedHashMap<>();
            source.forEach((branch, items) -> copy.put(branch.branchName(), List.copyOf(items)));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }
}
