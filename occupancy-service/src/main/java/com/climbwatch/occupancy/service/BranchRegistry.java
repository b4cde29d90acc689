package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.model.Branch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Read-only view of the tracked branches.
 */
@Component
public class BranchRegistry {

    private static final List<Branch> BRANCHES = List.of(Branch.values());

    /**
     * All tracked branches. Callers must not rely on the iteration order.
     */
    public List<Branch> listBranches() {
        return BRANCHES;
    }
}
