package com.waypoint.common.constants;

public final class RoutingConstants {

    private RoutingConstants() {}

    public static final String DEFAULT_REGIONS_CONFIG = "classpath:regions.yml";

    public static final int LATENCY_WINDOW_SIZE = 100;
    public static final double LATENCY_PERCENTILE = 0.95;

    public static final int DEFAULT_HEALTH_INTERVAL_SECONDS = 30;
    public static final int DEFAULT_PROBE_TIMEOUT_SECONDS = 5;
    public static final int DEFAULT_UNHEALTHY_THRESHOLD = 3;
    public static final int DEFAULT_HEALTHY_THRESHOLD = 2;
    public static final int DEFAULT_EXPECTED_STATUS = 200;

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final int DEFAULT_RESET_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_HALF_OPEN_REQUESTS = 3;

    public static final int DEFAULT_MAX_FAILOVER_SECONDS = 120;
    public static final double DEFAULT_ERROR_RATE_THRESHOLD = 0.05;
    public static final long DEFAULT_LATENCY_P95_THRESHOLD_MS = 1500;
    /** Samples (latencies or probe rounds) a region needs before it can be judged degraded. */
    public static final int DEGRADATION_MIN_SAMPLES = 20;

    public static final long DEFAULT_LATENCY_WARN_MS = 500;
    public static final long DEFAULT_LATENCY_CRITICAL_MS = 1000;

    public static final String METRIC_DECISIONS = "waypoint_routing_decisions_total";
    public static final String METRIC_UNAVAILABLE = "waypoint_routing_unavailable_total";
    public static final String METRIC_FEEDBACK = "waypoint_routing_feedback_total";
    public static final String METRIC_PROBE_LATENCY = "waypoint_probe_latency_seconds";
    public static final String METRIC_PROBE_FAILURES = "waypoint_probe_failures_total";
    public static final String METRIC_REGION_HEALTHY = "waypoint_region_healthy";
    public static final String METRIC_CIRCUIT_STATE = "waypoint_circuit_state";
    public static final String METRIC_CIRCUIT_TRANSITIONS = "waypoint_circuit_transitions_total";

    /**
     * Index of the given percentile in an ascending sample list of {@code sampleCount} entries:
     * {@code floor(percentile * sampleCount)}, clamped to the last index.
     */
    public static int percentileIndex(int sampleCount, double percentile) {
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive: " + sampleCount);
        }
        int index = (int) Math.floor(percentile * sampleCount);
        return Math.min(Math.max(index, 0), sampleCount - 1);
    }
}
