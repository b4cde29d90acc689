package com.climbwatch.occupancy.config;

import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.DataKind;
import com.climbwatch.occupancy.model.IngestionResult;
import com.climbwatch.occupancy.model.OccupancyReading;
import com.climbwatch.occupancy.service.BranchQueryService;
import com.climbwatch.occupancy.service.IngestionService;
import com.climbwatch.occupancy.service.ProjectIdResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class OccupancyController {

    private final IngestionService ingestionService;
    private final BranchQueryService queryService;
    private final ProjectIdResolver projectIdResolver;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> info() {
        return ResponseEntity.ok(Map.of(
                "service", "climbwatch-occupancy-service",
                "projectId", projectIdResolver.resolve(),
                "storageMode", queryService.storageMode()
        ));
    }

    // ── Occupancy ─────────────────────────────────────────────────────────────

    @GetMapping("/branches")
    public ResponseEntity<Map<String, List<OccupancyReading>>> branches() {
        return ResponseEntity.ok(queryService.occupancy());
    }

    /**
     * Pull the live occupancy of every branch and store it.
     *
     * POST /branches/store (GET is still accepted for existing cron callers)
     */
    @RequestMapping(value = "/branches/store", method = {RequestMethod.POST, RequestMethod.GET})
    public ResponseEntity<?> storeBranches() {
        return toResponse(ingestionService.runIngestionCycle(DataKind.OCCUPANCY));
    }

    // ── Expected attendance ───────────────────────────────────────────────────

    @GetMapping("/attendance")
    public ResponseEntity<Map<String, List<AttendanceSlot>>> attendance() {
        return ResponseEntity.ok(queryService.attendance());
    }

    /**
     * Refresh every branch's forecast. Meant to run once a day.
     *
     * POST /attendance/store (GET is still accepted for existing cron callers)
     */
    @RequestMapping(value = "/attendance/store", method = {RequestMethod.POST, RequestMethod.GET})
    public ResponseEntity<?> storeAttendance() {
        return toResponse(ingestionService.runIngestionCycle(DataKind.ATTENDANCE));
    }

    /**
     * Live forecast straight from the vendor, nothing stored.
     */
    @GetMapping("/attendance/preview")
    public ResponseEntity<Map<String, List<AttendanceSlot>>> previewAttendance() {
        return ResponseEntity.ok(ingestionService.previewAttendance());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ResponseEntity<?> toResponse(IngestionResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(Map.of(
                    "status", "Store Succeeded",
                    "kind", result.getKind().label(),
                    "branches", result.getStoredBranches()
            ));
        }
        String message = String.format("%s ingestion failed for %d branch(es)",
                result.getKind().label(), result.getErrors().size());
        return ResponseEntity.internalServerError()
                .body(new ErrorResponse("INGESTION_FAILED", message, result.getErrors()));
    }
}
