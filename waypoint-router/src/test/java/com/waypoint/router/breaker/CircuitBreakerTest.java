package com.waypoint.router.breaker;

import com.waypoint.common.dto.CircuitBreakerSnapshot;
import com.waypoint.common.model.CircuitState;
import com.waypoint.common.model.FailoverPolicy.CircuitBreakerSettings;
import com.waypoint.router.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private static final CircuitBreakerSettings SETTINGS = new CircuitBreakerSettings(true, 5, 2, 60, 3);

    private MutableClock clock;
    private List<String> transitions;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        transitions = new ArrayList<>();
        breaker = new CircuitBreaker("eu-west-1", SETTINGS, clock,
                (regionId, from, to) -> transitions.add(from + "->" + to));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordOutcome(false);
        }
    }

    private void openAndWait() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));
    }

    @Test
    void recordOutcome_staysClosed_belowFailureThreshold() {
        fail(4);

        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertEquals(4, breaker.snapshot().failureCount());
        assertTrue(breaker.isCandidate());
    }

    @Test
    void recordOutcome_opens_atFailureThreshold() {
        fail(5);

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(CircuitState.OPEN, snapshot.state());
        assertEquals(Instant.parse("2024-01-01T00:01:00Z"), snapshot.nextAttemptTime());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), snapshot.lastFailureTime());
        assertFalse(breaker.isCandidate());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void success_resetsConsecutiveFailures() {
        fail(4);
        breaker.recordOutcome(true);
        fail(4);

        assertEquals(CircuitState.CLOSED, breaker.currentState());
    }

    @Test
    void open_staysOpen_untilNextAttemptTime() {
        fail(5);
        clock.advance(Duration.ofSeconds(59));

        assertEquals(CircuitState.OPEN, breaker.currentState());
        assertFalse(breaker.tryAcquireTrial());
    }

    @Test
    void open_movesToHalfOpen_onFirstTouchAfterTimeout() {
        openAndWait();

        assertEquals(CircuitState.OPEN, breaker.peekState());
        assertTrue(breaker.isCandidate());
        assertEquals(CircuitState.HALF_OPEN, breaker.peekState());
        assertNull(breaker.snapshot().nextAttemptTime());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN"), transitions);
    }

    @Test
    void halfOpen_closes_afterSuccessThreshold() {
        openAndWait();

        breaker.recordOutcome(true);
        assertEquals(CircuitState.HALF_OPEN, breaker.currentState());
        breaker.recordOutcome(true);

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(CircuitState.CLOSED, snapshot.state());
        assertEquals(0, snapshot.failureCount());
        assertEquals(0, snapshot.successCount());
    }

    @Test
    void halfOpen_reopens_onSingleFailure() {
        openAndWait();
        breaker.recordOutcome(true);
        clock.advance(Duration.ofSeconds(5));

        breaker.recordOutcome(false);

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(CircuitState.OPEN, snapshot.state());
        assertEquals(0, snapshot.successCount());
        assertEquals(Instant.parse("2024-01-01T00:02:05Z"), snapshot.nextAttemptTime());
    }

    @Test
    void tryAcquireTrial_isCapped_inHalfOpen() {
        openAndWait();

        assertTrue(breaker.tryAcquireTrial());
        assertTrue(breaker.tryAcquireTrial());
        assertTrue(breaker.tryAcquireTrial());
        assertFalse(breaker.tryAcquireTrial());
        assertFalse(breaker.isCandidate());
        assertEquals(3, breaker.snapshot().halfOpenTrials());
    }

    @Test
    void success_returnsTrialSlot_inHalfOpen() {
        openAndWait();
        breaker.tryAcquireTrial();
        breaker.tryAcquireTrial();
        breaker.tryAcquireTrial();

        breaker.recordOutcome(true);

        assertTrue(breaker.isCandidate());
        assertEquals(2, breaker.snapshot().halfOpenTrials());
    }

    @Test
    void unansweredTrials_areRefilled_afterResetTimeout() {
        openAndWait();
        breaker.tryAcquireTrial();
        breaker.tryAcquireTrial();
        breaker.tryAcquireTrial();

        clock.advance(Duration.ofSeconds(59));
        assertFalse(breaker.isCandidate());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(breaker.isCandidate());
        assertEquals(CircuitState.HALF_OPEN, breaker.currentState());
        assertEquals(0, breaker.snapshot().halfOpenTrials());
        assertTrue(breaker.tryAcquireTrial());
    }

    @Test
    void tryAcquireTrial_isUnlimited_whenClosed() {
        for (int i = 0; i < 10; i++) {
            assertTrue(breaker.tryAcquireTrial());
        }
        assertEquals(0, breaker.snapshot().halfOpenTrials());
    }

    @Test
    void disabledBreaker_neverOpens() {
        CircuitBreaker disabled = new CircuitBreaker("eu-west-1",
                new CircuitBreakerSettings(false, 5, 2, 60, 3), clock, null);

        for (int i = 0; i < 20; i++) {
            disabled.recordOutcome(false);
        }

        assertEquals(CircuitState.CLOSED, disabled.currentState());
        assertEquals(0, disabled.snapshot().failureCount());
    }

    @Test
    void reset_closesOpenBreaker() {
        fail(5);

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.currentState());
        assertEquals(0, breaker.snapshot().failureCount());
        assertNull(breaker.snapshot().nextAttemptTime());
    }

    @Test
    void snapshot_doesNotAdvanceState() {
        openAndWait();

        assertEquals(CircuitState.OPEN, breaker.snapshot().state());
        assertEquals(CircuitState.OPEN, breaker.snapshot().state());
    }
}
