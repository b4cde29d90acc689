package com.climbwatch.occupancy.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO for one entry of the trendline-data array.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UrbanClimbTrendSlot {

    private Integer hour;

    // the vendor misspells this field
    @JsonProperty("percantage")
    @JsonAlias("percentage")
    private Double percentage;

    private Double remaining;
}
