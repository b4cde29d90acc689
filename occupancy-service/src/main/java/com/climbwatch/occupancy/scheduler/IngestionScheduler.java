package com.climbwatch.occupancy.scheduler;

import com.climbwatch.occupancy.config.OccupancyProperties;
import com.climbwatch.occupancy.model.DataKind;
import com.climbwatch.occupancy.service.IngestionService;
import com.climbwatch.occupancy.store.BranchStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Startup work and optional cron-driven ingestion.
 *
 * Both crons default to "-" (disabled): on Cloud Run the cycles are normally driven by
 * Cloud Scheduler calling the /store endpoints. Set OCCUPANCY_CRON / ATTENDANCE_CRON to
 * run them in-process instead.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionScheduler {

    private final IngestionService ingestionService;
    private final BranchStore store;
    private final OccupancyProperties properties;

    /**
     * On application startup:
     *  1. Ensure the store's tables exist
     *  2. Optionally take one occupancy reading if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            store.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise {} store schema: {}", store.describe(), e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running one occupancy cycle");
            try {
                ingestionService.runIngestionCycle(DataKind.OCCUPANCY);
            } catch (Exception e) {
                log.error("Startup ingestion failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Ingestion ready ({} store). Occupancy cron: {}, attendance cron: {}",
                    store.describe(),
                    properties.getScheduling().getOccupancyCron(),
                    properties.getScheduling().getAttendanceCron());
        }
    }

    @Scheduled(cron = "${occupancy.scheduling.occupancy-cron:-}", zone = "${occupancy.upstream.zone:Australia/Brisbane}")
    public void scheduledOccupancy() {
        log.info("Scheduled occupancy ingestion triggered");
        try {
            ingestionService.runIngestionCycle(DataKind.OCCUPANCY);
        } catch (Exception e) {
            log.error("Scheduled occupancy ingestion failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${occupancy.scheduling.attendance-cron:-}", zone = "${occupancy.upstream.zone:Australia/Brisbane}")
    public void scheduledAttendance() {
        log.info("Scheduled attendance ingestion triggered");
        try {
            ingestionService.runIngestionCycle(DataKind.ATTENDANCE);
        } catch (Exception e) {
            log.error("Scheduled attendance ingestion failed: {}", e.getMessage(), e);
        }
    }
}
