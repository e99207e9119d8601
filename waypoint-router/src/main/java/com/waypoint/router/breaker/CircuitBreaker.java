package com.waypoint.router.breaker;

import com.waypoint.common.dto.CircuitBreakerSnapshot;
import com.waypoint.common.model.CircuitState;
import com.waypoint.common.model.FailoverPolicy.CircuitBreakerSettings;

import java.time.Clock;
import java.time.Instant;

/**
 * Three-state breaker for one region.
 *
 * <p>CLOSED opens after {@code failure_threshold} consecutive failures. OPEN becomes HALF_OPEN
 * lazily, on the first touch at or after {@code next_attempt_time}. HALF_OPEN closes after
 * {@code success_threshold} successes and re-opens on any failure. While HALF_OPEN at most
 * {@code half_open_requests} routing decisions may pick the region; each recorded success gives
 * one slot back. The whole budget is refilled every {@code timeout_seconds} spent in HALF_OPEN.
 *
 * <p>Every method runs under this object's monitor.
 */
public class CircuitBreaker {

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String regionId, CircuitState from, CircuitState to);
    }

    private final String regionId;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final TransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant nextAttemptTime;
    private int halfOpenTrials;
    private Instant trialsRefillTime;

    public CircuitBreaker(String regionId, CircuitBreakerSettings settings, Clock clock, TransitionListener listener) {
        this.regionId = regionId;
        this.settings = settings;
        this.clock = clock;
        this.listener = listener;
    }

    public String regionId() {
        return regionId;
    }

    /** Current state, moving OPEN to HALF_OPEN first when the reset timeout has elapsed. */
    public synchronized CircuitState currentState() {
        advance(clock.instant());
        return state;
    }

    /** Current state without the lazy OPEN to HALF_OPEN move. */
    public synchronized CircuitState peekState() {
        return state;
    }

    public synchronized boolean isCandidate() {
        advance(clock.instant());
        return switch (state) {
            case CLOSED -> true;
            case HALF_OPEN -> halfOpenTrials < settings.halfOpenRequests();
            case OPEN -> false;
        };
    }

    /**
     * Claims the right to route one request to this region. Always granted when CLOSED; granted
     * in HALF_OPEN only while trial slots remain.
     */
    public synchronized boolean tryAcquireTrial() {
        advance(clock.instant());
        if (state == CircuitState.CLOSED) {
            return true;
        }
        if (state == CircuitState.HALF_OPEN && halfOpenTrials < settings.halfOpenRequests()) {
            halfOpenTrials++;
            return true;
        }
        return false;
    }

    public synchronized void recordOutcome(boolean success) {
        if (!settings.enabled()) {
            return;
        }
        Instant now = clock.instant();
        advance(now);
        if (success) {
            onSuccess(now);
        } else {
            onFailure(now);
        }
    }

    public synchronized void reset() {
        transitionTo(CircuitState.CLOSED, clock.instant());
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(regionId, state, failureCount, successCount,
                lastFailureTime, nextAttemptTime, halfOpenTrials);
    }

    private void onSuccess(Instant now) {
        failureCount = 0;
        successCount++;
        if (state == CircuitState.HALF_OPEN) {
            if (successCount >= settings.successThreshold()) {
                transitionTo(CircuitState.CLOSED, now);
            } else if (halfOpenTrials > 0) {
                halfOpenTrials--;
            }
        }
    }

    private void onFailure(Instant now) {
        failureCount++;
        successCount = 0;
        lastFailureTime = now;
        if (state == CircuitState.HALF_OPEN
                || (state == CircuitState.CLOSED && failureCount >= settings.failureThreshold())) {
            transitionTo(CircuitState.OPEN, now);
        }
    }

    private void advance(Instant now) {
        if (state == CircuitState.OPEN && nextAttemptTime != null && !now.isBefore(nextAttemptTime)) {
            transitionTo(CircuitState.HALF_OPEN, now);
        } else if (state == CircuitState.HALF_OPEN && !now.isBefore(trialsRefillTime)) {
            halfOpenTrials = 0;
            trialsRefillTime = now.plus(settings.resetTimeout());
        }
    }

    private void transitionTo(CircuitState next, Instant now) {
        CircuitState previous = state;
        state = next;
        halfOpenTrials = 0;
        trialsRefillTime = next == CircuitState.HALF_OPEN ? now.plus(settings.resetTimeout()) : null;
        if (next == CircuitState.OPEN) {
            nextAttemptTime = now.plus(settings.resetTimeout());
        } else {
            failureCount = 0;
            successCount = 0;
            nextAttemptTime = null;
        }
        if (previous != next && listener != null) {
            listener.onTransition(regionId, previous, next);
        }
    }
}
