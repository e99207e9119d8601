package com.waypoint.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static description of one regional deployment. Immutable once the catalog is loaded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegionConfig(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty("name") String name,
        @JsonProperty("provider") String provider,
        @JsonProperty(value = "priority", required = true) int priority,
        @JsonProperty(value = "status", required = true) RegionStatus status,
        @JsonProperty("capabilities") Set<String> capabilities,
        @JsonProperty("data_residency") String dataResidency,
        @JsonProperty("latency_target_p95") Long latencyTargetP95Ms,
        @JsonProperty("health_endpoints") List<HealthEndpoint> healthEndpoints,
        @JsonProperty("deployment_url") String deploymentUrl
) {
    public RegionConfig {
        if (name == null || name.isBlank()) name = id;
        capabilities = capabilities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        healthEndpoints = healthEndpoints == null ? List.of() : List.copyOf(healthEndpoints);
    }

    public boolean isActive() {
        return status == RegionStatus.ACTIVE;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public boolean residesIn(String residencyTag) {
        return residencyTag.equals(dataResidency);
    }
}
