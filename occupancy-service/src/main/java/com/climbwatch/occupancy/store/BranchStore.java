package com.climbwatch.occupancy.store;

import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.Branch;
import com.climbwatch.occupancy.model.OccupancyReading;

import java.util.List;
import java.util.Map;

/**
 * Storage backend for branch readings.
 *
 * Occupancy is append-only history. Attendance is a per-branch forecast that each
 * refresh replaces wholesale. Read methods key their result by branch name and
 * include every branch, with an empty list when nothing is stored.
 */
public interface BranchStore {

    void recordOccupancy(Branch branch, OccupancyReading reading);

    /**
     * Replace the branch's forecast with {@code slots}. Other branches are untouched,
     * and a failed replace leaves the previous forecast in place.
     */
    void replaceAttendance(Branch branch, List<AttendanceSlot> slots);

    Map<String, List<OccupancyReading>> readOccupancy();

    Map<String, List<AttendanceSlot>> readAttendance();

    /** Create backing tables if the backend needs them. */
    default void ensureSchema() {
    }

    /** Short label for logs and the info endpoint, e.g. "memory" */
    String describe();
}
