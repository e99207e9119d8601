package com.waypoint.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.common.constants.RoutingConstants;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingPolicy(
        @JsonProperty(value = "strategy", required = true) RoutingStrategy strategy,
        @JsonProperty("geo_routing") List<GeoRoutingRule> geoRules,
        @JsonProperty("latency_thresholds") LatencyThresholds latencyThresholds
) {
    public RoutingPolicy {
        geoRules = geoRules == null ? List.of() : List.copyOf(geoRules);
        if (latencyThresholds == null) latencyThresholds = LatencyThresholds.defaults();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LatencyThresholds(
            @JsonProperty("warn") long warnMs,
            @JsonProperty("critical") long criticalMs
    ) {
        public LatencyThresholds {
            if (warnMs == 0) warnMs = RoutingConstants.DEFAULT_LATENCY_WARN_MS;
            if (criticalMs == 0) criticalMs = RoutingConstants.DEFAULT_LATENCY_CRITICAL_MS;
        }

        public static LatencyThresholds defaults() {
            return new LatencyThresholds(0, 0);
        }

        public LatencyLevel classify(long p95Ms) {
            if (p95Ms >= criticalMs) return LatencyLevel.CRITICAL;
            if (p95Ms >= warnMs) return LatencyLevel.WARN;
            return LatencyLevel.OK;
        }
    }
}
