package com.waypoint.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.common.constants.RoutingConstants;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthEndpoint(
        @JsonProperty(value = "path", required = true) String path,
        @JsonProperty("expected_status") int expectedStatus
) {
    public HealthEndpoint {
        if (expectedStatus == 0) {
            expectedStatus = RoutingConstants.DEFAULT_EXPECTED_STATUS;
        }
    }
}
