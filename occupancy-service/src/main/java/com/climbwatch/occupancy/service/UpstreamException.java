package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.model.Branch;
import lombok.Getter;

/**
 * Raised when the Urban Climb API cannot be reached or returns something unusable.
 */
@Getter
public class UpstreamException extends RuntimeException {

    public enum Kind {
        FETCH, DECODE
    }

    private final Kind kind;
    private final Branch branch;

    public UpstreamException(Kind kind, Branch branch, String message) {
        super(message);
        this.kind = kind;
        this.branch = branch;
    }

    public UpstreamException(Kind kind, Branch branch, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.branch = branch;
    }
}
