package com.waypoint.common.dto;

import com.waypoint.common.model.CircuitState;

import java.time.Instant;

public record CircuitBreakerSnapshot(
        String regionId,
        CircuitState state,
        int failureCount,
        int successCount,
        Instant lastFailureTime,
        Instant nextAttemptTime,
        int halfOpenTrials
) {}
