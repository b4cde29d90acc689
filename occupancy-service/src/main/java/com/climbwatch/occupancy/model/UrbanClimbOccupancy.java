package com.climbwatch.occupancy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the occupancy.ashx JSON object.
 * Kept separate from the domain model to isolate vendor coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UrbanClimbOccupancy {

    @JsonProperty("LastUpdated")
    private String lastUpdated;

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Status")
    private String status;

    @JsonProperty("CurrentPercentage")
    private Double currentPercentage;
}
