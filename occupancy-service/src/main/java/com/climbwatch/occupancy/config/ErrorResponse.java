package com.climbwatch.occupancy.config;

import com.climbwatch.occupancy.model.BranchError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body returned by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String kind, String message, List<BranchError> errors) {

    public ErrorResponse(String kind, String message) {
        this(kind, message, List.of());
    }
}
