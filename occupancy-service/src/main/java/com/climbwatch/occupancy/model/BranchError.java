package com.climbwatch.occupancy.model;

/**
 * A failure for one branch during an ingestion cycle.
 */
public record BranchError(String branch, Kind kind, String message) {

    public enum Kind {
        /** Network error, timeout or non-2xx answer from the vendor */
        FETCH,
        /** Vendor answered but the body did not have the expected shape */
        DECODE,
        /** Writing to the store failed */
        STORE,
        /** The cycle deadline passed before the branch was attempted */
        TIMEOUT
    }

    public static BranchError of(Branch branch, Kind kind, String message) {
        return new BranchError(branch.branchName(), kind, message);
    }
}
