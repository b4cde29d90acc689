package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.config.OccupancyProperties;
import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.OccupancyReading;
import com.climbwatch.occupancy.model.UrbanClimbOccupancy;
import com.climbwatch.occupancy.model.UrbanClimbTrendSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Maps raw Urban Climb responses to the normalised domain model.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BranchReadingMapper {

    private final OccupancyProperties properties;

    public OccupancyReading toReading(UrbanClimbOccupancy raw) {
        return OccupancyReading.builder()
                .lastUpdated(parseLastUpdated(raw.getLastUpdated()))
                .name(raw.getName())
                .status(raw.getStatus())
                .currentPercentage(raw.getCurrentPercentage() != null ? raw.getCurrentPercentage() : 0.0)
                .build();
    }

    /**
     * Callers must have checked that hour and percentage are present.
     */
    public AttendanceSlot toSlot(UrbanClimbTrendSlot raw) {
        return AttendanceSlot.builder()
                .hour(raw.getHour())
                .percentage(raw.getPercentage())
                .remaining(raw.getRemaining())
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * The vendor usually sends an ISO timestamp with offset. Values without one are
     * taken to be local time at the gyms.
     */
    OffsetDateTime parseLastUpdated(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset;
            }
            return ((LocalDateTime) parsed)
                    .atZone(ZoneId.of(properties.getUpstream().getZone()))
                    .toOffsetDateTime();
        } catch (DateTimeParseException e) {
            log.warn("Could not parse LastUpdated: {}", value);
            return null;
        }
    }
}
