package com.waypoint.common.dto;

import com.waypoint.common.model.LatencyLevel;

import java.time.Instant;

/**
 * Point-in-time copy of a region's health. {@code latencyP95Ms} is null until the region has
 * produced a latency sample; {@code meetsLatencyTarget} is null when either side is unknown.
 */
public record RegionHealthSnapshot(
        String regionId,
        boolean healthy,
        int consecutiveFailures,
        int consecutiveSuccesses,
        Instant lastCheckTime,
        Long latencyP95Ms,
        double errorRate,
        LatencyLevel latencyLevel,
        boolean degraded,
        Boolean meetsLatencyTarget
) {}
