package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.config.OccupancyProperties;
import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.Branch;
import com.climbwatch.occupancy.model.BranchError;
import com.climbwatch.occupancy.model.DataKind;
import com.climbwatch.occupancy.model.IngestionResult;
import com.climbwatch.occupancy.model.OccupancyReading;
import com.climbwatch.occupancy.store.BranchStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs ingestion cycles: one pass over every branch fetching and storing one kind of data.
 *
 * A cycle is best effort. Each branch is fetched and stored on its own, a failure is
 * recorded against that branch and the loop moves on. Nothing already stored is rolled
 * back. Cycles of the same kind never overlap.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final BranchRegistry branchRegistry;
    private final UrbanClimbClient client;
    private final BranchStore store;
    private final OccupancyProperties properties;

    private final Map<DataKind, ReentrantLock> cycleLocks = new EnumMap<>(Map.of(
            DataKind.OCCUPANCY, new ReentrantLock(),
            DataKind.ATTENDANCE, new ReentrantLock()));

    /**
     * Fetch and store {@code kind} for every branch.
     *
     * Branches not yet attempted when occupancy.ingestion.cycle-timeout runs out are
     * reported as TIMEOUT. The deadline is checked between branches; a call already in
     * flight is bounded by the client's read timeout instead.
     */
    public IngestionResult runIngestionCycle(DataKind kind) {
        ReentrantLock lock = cycleLocks.get(kind);
        lock.lock();
        try {
            return runCycle(kind);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fetch every branch's forecast without storing it. Branches that fail are left out.
     */
    public Map<String, List<AttendanceSlot>> previewAttendance() {
        Map<String, List<AttendanceSlot>> preview = new LinkedHashMap<>();
        for (Branch branch : branchRegistry.listBranches()) {
            try {
                preview.put(branch.branchName(), client.fetchExpectedAttendance(branch));
            } catch (UpstreamException e) {
                log.warn("Preview skipped {}: {}", branch.branchName(), e.getMessage());
            }
        }
        return preview;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private IngestionResult runCycle(DataKind kind) {
        log.info("Starting {} ingestion cycle", kind.label());
        Instant deadline = Instant.now().plus(properties.getIngestion().getCycleTimeout());
        IngestionResult.IngestionResultBuilder result = IngestionResult.builder()
                .kind(kind)
                .startedAt(LocalDateTime.now());

        for (Branch branch : branchRegistry.listBranches()) {
            if (!Instant.now().isBefore(deadline)) {
                log.warn("Cycle deadline passed before {} was attempted", branch.branchName());
                result.error(BranchError.of(branch, BranchError.Kind.TIMEOUT,
                        "Cycle deadline passed before " + branch.branchName() + " was attempted"));
                continue;
            }

            try {
                ingestBranch(kind, branch);
                result.stored(branch.branchName());
            } catch (UpstreamException e) {
                BranchError.Kind errorKind = e.getKind() == UpstreamException.Kind.FETCH
                        ? BranchError.Kind.FETCH
                        : BranchError.Kind.DECODE;
                result.error(BranchError.of(branch, errorKind, e.getMessage()));
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed storing {} for {}: {}", kind.label(), branch.branchName(), e.getMessage(), e);
                result.error(BranchError.of(branch, BranchError.Kind.STORE, e.getMostSpecificCause().getMessage()));
            }
        }

        IngestionResult outcome = result.completedAt(LocalDateTime.now()).build();
        if (outcome.isSuccess()) {
            log.info("{} ingestion cycle complete: stored {}", kind.label(), outcome.getStoredBranches());
        } else {
            log.warn("{} ingestion cycle finished with {} error(s); stored {}",
                    kind.label(), outcome.getErrors().size(), outcome.getStoredBranches());
        }
        return outcome;
    }

    private void ingestBranch(DataKind kind, Branch branch) {
        switch (kind) {
            case OCCUPANCY -> {
                OccupancyReading reading = client.fetchOccupancy(branch);
                store.recordOccupancy(branch, reading);
                log.debug("{} at {}% ({})", branch.branchName(), reading.getCurrentPercentage(), reading.getStatus());
            }
            case ATTENDANCE -> {
                List<AttendanceSlot> slots = client.fetchExpectedAttendance(branch);
                store.replaceAttendance(branch, slots);
                log.debug("{} forecast refreshed with {} slots", branch.branchName(), slots.size());
            }
        }
    }
}
