package com.climbwatch.occupancy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of one ingestion cycle over every branch.
 * A cycle is successful only when no branch reported an error.
 */
@Value
@Builder
public class IngestionResult {

    DataKind kind;
    LocalDateTime startedAt;
    LocalDateTime completedAt;

    @Singular("stored")
    List<String> storedBranches;

    @Singular
    List<BranchError> errors;

    @JsonIgnore
    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
