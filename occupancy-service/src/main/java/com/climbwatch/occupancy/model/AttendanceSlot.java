package com.climbwatch.occupancy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One hour of a branch's expected-attendance forecast.
 */
@Value
@Builder
public class AttendanceSlot {

    /** Hour of day, 0-23 */
    int hour;

    double percentage;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Double remaining;
}
