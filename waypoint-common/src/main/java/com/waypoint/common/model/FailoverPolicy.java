package com.waypoint.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.common.constants.RoutingConstants;

import java.time.Duration;
import java.util.List;

/**
 * Health-check, circuit-breaker and automatic-failover parameters. Absent or zero numeric
 * values fall back to the defaults in {@link RoutingConstants}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FailoverPolicy(
        @JsonProperty("health_check") HealthCheckSettings healthCheck,
        @JsonProperty("circuit_breaker") CircuitBreakerSettings circuitBreaker,
        @JsonProperty("automatic_failover") AutomaticFailoverSettings automaticFailover
) {
    public FailoverPolicy {
        if (healthCheck == null) healthCheck = HealthCheckSettings.defaults();
        if (circuitBreaker == null) circuitBreaker = CircuitBreakerSettings.defaults();
        if (automaticFailover == null) automaticFailover = AutomaticFailoverSettings.defaults();
    }

    public static FailoverPolicy defaults() {
        return new FailoverPolicy(null, null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HealthCheckSettings(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("interval_seconds") int intervalSeconds,
            @JsonProperty("timeout_seconds") int timeoutSeconds,
            @JsonProperty("unhealthy_threshold") int unhealthyThreshold,
            @JsonProperty("healthy_threshold") int healthyThreshold,
            @JsonProperty("endpoints") List<HealthEndpoint> endpoints
    ) {
        public HealthCheckSettings {
            if (enabled == null) enabled = Boolean.TRUE;
            if (intervalSeconds == 0) intervalSeconds = RoutingConstants.DEFAULT_HEALTH_INTERVAL_SECONDS;
            if (timeoutSeconds == 0) timeoutSeconds = RoutingConstants.DEFAULT_PROBE_TIMEOUT_SECONDS;
            if (unhealthyThreshold == 0) unhealthyThreshold = RoutingConstants.DEFAULT_UNHEALTHY_THRESHOLD;
            if (healthyThreshold == 0) healthyThreshold = RoutingConstants.DEFAULT_HEALTHY_THRESHOLD;
            endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        }

        public static HealthCheckSettings defaults() {
            return new HealthCheckSettings(null, 0, 0, 0, 0, null);
        }

        public Duration interval() {
            return Duration.ofSeconds(intervalSeconds);
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CircuitBreakerSettings(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("failure_threshold") int failureThreshold,
            @JsonProperty("success_threshold") int successThreshold,
            @JsonProperty("timeout_seconds") int resetTimeoutSeconds,
            @JsonProperty("half_open_requests") int halfOpenRequests
    ) {
        public CircuitBreakerSettings {
            if (enabled == null) enabled = Boolean.TRUE;
            if (failureThreshold == 0) failureThreshold = RoutingConstants.DEFAULT_FAILURE_THRESHOLD;
            if (successThreshold == 0) successThreshold = RoutingConstants.DEFAULT_SUCCESS_THRESHOLD;
            if (resetTimeoutSeconds == 0) resetTimeoutSeconds = RoutingConstants.DEFAULT_RESET_TIMEOUT_SECONDS;
            if (halfOpenRequests == 0) halfOpenRequests = RoutingConstants.DEFAULT_HALF_OPEN_REQUESTS;
        }

        public static CircuitBreakerSettings defaults() {
            return new CircuitBreakerSettings(null, 0, 0, 0, 0);
        }

        public Duration resetTimeout() {
            return Duration.ofSeconds(resetTimeoutSeconds);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AutomaticFailoverSettings(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("max_failover_time_seconds") int maxFailoverTimeSeconds,
            @JsonProperty("error_rate_threshold") double errorRateThreshold,
            @JsonProperty("latency_p95_threshold") long latencyP95ThresholdMs
    ) {
        public AutomaticFailoverSettings {
            if (enabled == null) enabled = Boolean.FALSE;
            if (maxFailoverTimeSeconds == 0) maxFailoverTimeSeconds = RoutingConstants.DEFAULT_MAX_FAILOVER_SECONDS;
            if (errorRateThreshold == 0) errorRateThreshold = RoutingConstants.DEFAULT_ERROR_RATE_THRESHOLD;
            if (latencyP95ThresholdMs == 0) latencyP95ThresholdMs = RoutingConstants.DEFAULT_LATENCY_P95_THRESHOLD_MS;
        }

        public static AutomaticFailoverSettings defaults() {
            return new AutomaticFailoverSettings(null, 0, 0, 0);
        }
    }
}
