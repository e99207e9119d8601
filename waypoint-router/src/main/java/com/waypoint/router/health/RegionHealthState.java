package com.waypoint.router.health;

import com.waypoint.common.dto.RegionHealthSnapshot;
import com.waypoint.common.model.LatencyLevel;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable health record for one region. Starts healthy with no check recorded. All access goes
 * through this object's monitor.
 */
final class RegionHealthState {

    enum Transition { NONE, RECOVERED, FAILED }

    private final String regionId;
    private final int outcomeWindow;
    private final Deque<Boolean> recentOutcomes;

    private boolean healthy = true;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Instant lastCheckTime;
    private LatencyLevel latencyLevel = LatencyLevel.UNKNOWN;

    RegionHealthState(String regionId, int outcomeWindow) {
        this.regionId = regionId;
        this.outcomeWindow = outcomeWindow;
        this.recentOutcomes = new ArrayDeque<>(outcomeWindow + 1);
    }

    synchronized Transition recordProbe(boolean success, Instant now, int unhealthyThreshold, int healthyThreshold) {
        lastCheckTime = now;
        recentOutcomes.addLast(success);
        while (recentOutcomes.size() > outcomeWindow) {
            recentOutcomes.removeFirst();
        }

        if (success) {
            consecutiveSuccesses++;
            consecutiveFailures = 0;
            if (!healthy && consecutiveSuccesses >= healthyThreshold) {
                healthy = true;
                return Transition.RECOVERED;
            }
        } else {
            consecutiveFailures++;
            consecutiveSuccesses = 0;
            if (healthy && consecutiveFailures >= unhealthyThreshold) {
                healthy = false;
                return Transition.FAILED;
            }
        }
        return Transition.NONE;
    }

    synchronized LatencyLevel updateLatencyLevel(LatencyLevel level) {
        LatencyLevel previous = latencyLevel;
        latencyLevel = level;
        return previous;
    }

    synchronized boolean isHealthy() {
        return healthy;
    }

    /**
     * Whether the windowed error rate exceeds {@code threshold}. Never true before the window
     * holds {@code minRounds} outcomes and at least {@code minFailures} of them failed.
     */
    synchronized boolean errorRateBreached(double threshold, int minRounds, int minFailures) {
        if (recentOutcomes.size() < minRounds) {
            return false;
        }
        long failures = failuresLocked();
        return failures >= minFailures && (double) failures / recentOutcomes.size() > threshold;
    }

    synchronized RegionHealthSnapshot snapshot(Long p95Ms, boolean degraded, Boolean meetsTarget) {
        return new RegionHealthSnapshot(regionId, healthy, consecutiveFailures, consecutiveSuccesses,
                lastCheckTime, p95Ms, errorRateLocked(), latencyLevel, degraded, meetsTarget);
    }

    private double errorRateLocked() {
        if (recentOutcomes.isEmpty()) {
            return 0.0;
        }
        return (double) failuresLocked() / recentOutcomes.size();
    }

    private long failuresLocked() {
        return recentOutcomes.stream().filter(ok -> !ok).count();
    }
}
