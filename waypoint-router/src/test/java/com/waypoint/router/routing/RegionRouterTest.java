package com.waypoint.router.routing;

import com.waypoint.common.dto.CircuitBreakerSnapshot;
import com.waypoint.common.dto.RegionHealthSnapshot;
import com.waypoint.common.model.CircuitState;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.router.RouterFixture;
import com.waypoint.router.catalog.UnknownRegionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RegionRouterTest {

    private RouterFixture fixture;
    private RegionRouter router;

    @BeforeEach
    void setUp() {
        fixture = RouterFixture.standard("priority-based");
        router = fixture.router;
    }

    private String route(String residency) {
        return router.getOptimalRegion(null, null, residency).map(RegionConfig::id).orElse(null);
    }

    private void fail(String regionId, int times) {
        for (int i = 0; i < times; i++) {
            router.recordFailure(regionId);
        }
    }

    @Test
    void getOptimalRegion_worksImmediatelyAfterConstruction() {
        assertEquals("us-east-1", route(null));
    }

    @Test
    void openBreaker_blocksCandidacy_evenWhenHealthy() {
        fail("us-east-1", 5);

        assertTrue(router.getRegionHealthStatus().get("us-east-1").healthy());
        assertEquals(CircuitState.OPEN, router.getCircuitState("us-east-1"));
        assertEquals("us-west-2", route("us"));
    }

    @Test
    void breaker_recoversThroughHalfOpen() {
        fail("us-east-1", 5);
        fixture.clock.advance(Duration.ofSeconds(60));

        assertEquals("us-east-1", route("us"));
        assertEquals(CircuitState.HALF_OPEN, router.getCircuitState("us-east-1"));

        router.recordSuccess("us-east-1");
        router.recordSuccess("us-east-1");

        assertEquals(CircuitState.CLOSED, router.getCircuitState("us-east-1"));
    }

    @Test
    void halfOpen_reopensOnFailure() {
        fail("us-east-1", 5);
        fixture.clock.advance(Duration.ofSeconds(60));
        route("us");

        router.recordFailure("us-east-1");

        assertEquals(CircuitState.OPEN, router.getCircuitState("us-east-1"));
        assertEquals("us-west-2", route("us"));
    }

    @Test
    void halfOpen_limitsTrialDecisions() {
        fail("us-east-1", 5);
        fixture.clock.advance(Duration.ofSeconds(60));

        assertEquals("us-east-1", route("us"));
        assertEquals("us-east-1", route("us"));
        assertEquals("us-east-1", route("us"));
        assertEquals("us-west-2", route("us"));
    }

    @Test
    void getOptimalRegion_returnsEmpty_whenNothingEligible() {
        for (RegionConfig region : fixture.catalog.activeRegions()) {
            fail(region.id(), 5);
        }

        assertEquals(Optional.empty(), router.getOptimalRegion("DE", null, null));
        assertEquals(1.0, fixture.meterRegistry.get("waypoint_routing_unavailable_total").counter().count());
        assertEquals(0, router.routableRegionCount());
    }

    @Test
    void getOptimalRegion_returnsEmpty_forUnmatchedResidency() {
        assertEquals(Optional.empty(), router.getOptimalRegion(null, null, "apac"));
    }

    @Test
    void decisions_areCounted() {
        route(null);
        route(null);

        assertEquals(2.0, fixture.meterRegistry.get("waypoint_routing_decisions_total")
                .tag("region", "us-east-1").counter().count());
    }

    @Test
    void feedback_rejectsUnknownRegion() {
        assertThrows(UnknownRegionException.class, () -> router.recordFailure("mars-1"));
        assertThrows(UnknownRegionException.class, () -> router.recordSuccess(null));
        assertFalse(router.getCircuitBreakerStatus().containsKey("mars-1"));
    }

    @Test
    void feedback_isCountedPerOutcome() {
        router.recordSuccess("eu-west-1");
        router.recordFailure("eu-west-1");

        assertEquals(1.0, fixture.meterRegistry.get("waypoint_routing_feedback_total")
                .tag("region", "eu-west-1").tag("outcome", "failure").counter().count());
    }

    @Test
    void statusSnapshots_areDetachedCopies() {
        Map<String, CircuitBreakerSnapshot> before = router.getCircuitBreakerStatus();
        Map<String, RegionHealthSnapshot> health = router.getRegionHealthStatus();

        fail("eu-west-1", 5);

        assertEquals(CircuitState.CLOSED, before.get("eu-west-1").state());
        assertEquals(CircuitState.OPEN, router.getCircuitBreakerStatus().get("eu-west-1").state());
        assertThrows(UnsupportedOperationException.class, () -> before.remove("eu-west-1"));
        assertThrows(UnsupportedOperationException.class, () -> health.clear());
    }

    @Test
    void resetCircuitBreaker_restoresCandidacy() {
        fail("us-east-1", 5);

        router.resetCircuitBreaker("us-east-1");

        assertEquals("us-east-1", route("us"));
    }

    @Test
    void stopHealthChecks_isIdempotent_andSafeBeforeStart() {
        assertDoesNotThrow(() -> {
            router.stopHealthChecks();
            router.stopHealthChecks();
        });

        router.startHealthChecks();
        assertTrue(router.isHealthCheckRunning());
        router.stopHealthChecks();
        router.stopHealthChecks();
        assertFalse(router.isHealthCheckRunning());
    }

    @Test
    void applicationReady_doesNotStartChecks_whenDisabled() {
        router.onApplicationReady();

        assertFalse(router.isHealthCheckRunning());
    }

    @Test
    void introspection_exposesCatalog() {
        assertEquals(4, router.getActiveRegions().size());
        assertTrue(router.getRegionById("ap-south-1").isPresent());
        assertTrue(router.getRegionById("mars-1").isEmpty());
    }
}
