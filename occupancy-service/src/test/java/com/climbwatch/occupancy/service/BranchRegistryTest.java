package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.model.Branch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BranchRegistry unit tests")
class BranchRegistryTest {

    private final BranchRegistry registry = new BranchRegistry();

    @Test
    @DisplayName("lists exactly the three tracked branches")
    void listsThreeBranches() {
        // when
        List<Branch> branches = registry.listBranches();

        // then
        assertThat(branches)
                .extracting(Branch::branchName)
                .containsExactlyInAnyOrder("westend", "milton", "newstead");
    }

    @Test
    @DisplayName("storage ids are distinct small integers and map back to the same branch")
    void storageIdsRoundTrip() {
        // given
        List<Branch> branches = registry.listBranches();

        // when
        Set<Integer> ids = branches.stream().map(Branch::storageId).collect(Collectors.toSet());

        // then
        assertThat(ids).hasSize(3).allMatch(id -> id >= 0 && id < 10);
        for (Branch branch : branches) {
            assertThat(Branch.fromStorageId(branch.storageId())).contains(branch);
            assertThat(Branch.fromName(branch.branchName())).contains(branch);
        }
    }

    @Test
    @DisplayName("upstream ids are distinct")
    void upstreamIdsDistinct() {
        assertThat(registry.listBranches())
                .extracting(Branch::upstreamId)
                .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("unknown names and storage ids resolve to nothing")
    void unknownLookups() {
        assertThat(Branch.fromName("fortitude-valley")).isEmpty();
        assertThat(Branch.fromName(null)).isEmpty();
        assertThat(Branch.fromStorageId(99)).isEmpty();
        assertThat(Branch.fromName(" Milton ")).contains(Branch.MILTON);
    }

    @Test
    @DisplayName("the branch list cannot be modified")
    void listIsImmutable() {
        List<Branch> branches = registry.listBranches();

        assertThatThrownBy(() -> branches.add(Branch.WESTEND))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
