package com.waypoint.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RegionStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("inactive") INACTIVE,
    @JsonProperty("maintenance") MAINTENANCE
}
