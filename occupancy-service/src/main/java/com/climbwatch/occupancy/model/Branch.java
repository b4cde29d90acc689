package com.climbwatch.occupancy.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The three Urban Climb gyms this service tracks.
 *
 * Each branch carries the opaque identifier the vendor API expects and the small
 * integer used as branch_id in the relational tables. The set is closed: adding a
 * branch means a code change, never a runtime registration.
 */
public enum Branch {

    WESTEND("westend", "D969F1B2-0C9F-49A9-B2AC-D7775642F298", 0),
    MILTON("milton", "690326F9-98CE-4249-BD91-53A0676A137B", 1),
    NEWSTEAD("newstead", "A3010228-DFC6-4317-86C0-3839FFDF3FD0", 2);

    private final String branchName;
    private final String upstreamId;
    private final int storageId;

    Branch(String branchName, String upstreamId, int storageId) {
        this.branchName = branchName;
        this.upstreamId = upstreamId;
        this.storageId = storageId;
    }

    /** Lower-case name used as the key in every JSON response, e.g. "westend" */
    public String branchName() {
        return branchName;
    }

    public String upstreamId() {
        return upstreamId;
    }

    public int storageId() {
        return storageId;
    }

    public static Optional<Branch> fromName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(b -> b.branchName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public static Optional<Branch> fromStorageId(int storageId) {
        return Arrays.stream(values())
                .filter(b -> b.storageId == storageId)
                .findFirst();
    }
}
