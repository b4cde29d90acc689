package com.climbwatch.occupancy.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Normalised point-in-time occupancy of one branch.
 *
 * Readings are only ever appended, never updated in place.
 */
@Value
@Builder
public class OccupancyReading {

    /** When the vendor last refreshed the figure; null if the vendor value was unparseable */
    OffsetDateTime lastUpdated;

    /** Display name as the vendor returns it, e.g. "West End" */
    String name;

    /** Free-text label such as "Quiet" or "Busy" */
    String status;

    /** 0-100 */
    double currentPercentage;
}
