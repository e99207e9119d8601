package com.waypoint.router.breaker;

import com.waypoint.common.constants.RoutingConstants;
import com.waypoint.common.dto.CircuitBreakerSnapshot;
import com.waypoint.common.model.CircuitState;
import com.waypoint.common.model.FailoverPolicy.CircuitBreakerSettings;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.router.catalog.RegionCatalog;
import com.waypoint.router.catalog.UnknownRegionException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@link CircuitBreaker} per catalog region. Synthetic probes and real-traffic feedback both
 * report through {@link #recordOutcome(String, boolean)}.
 */
@Component
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers;
    private final MeterRegistry meterRegistry;

    public CircuitBreakerRegistry(RegionCatalog catalog, Clock clock, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        CircuitBreakerSettings settings = catalog.failoverPolicy().circuitBreaker();
        if (!settings.enabled()) {
            log.info("Circuit breakers disabled, all regions stay CLOSED");
        }

        Map<String, CircuitBreaker> byRegion = new LinkedHashMap<>();
        for (RegionConfig region : catalog.regions()) {
            CircuitBreaker breaker = new CircuitBreaker(region.id(), settings, clock, this::onTransition);
            byRegion.put(region.id(), breaker);
            Gauge.builder(RoutingConstants.METRIC_CIRCUIT_STATE, breaker, b -> b.peekState().ordinal())
                    .tag("region", region.id())
                    .description("Circuit state per region: 0=closed, 1=open, 2=half_open")
                    .register(meterRegistry);
        }
        this.breakers = Collections.unmodifiableMap(byRegion);
    }

    public void recordOutcome(String regionId, boolean success) {
        breaker(regionId).recordOutcome(success);
    }

    /** False while the breaker is OPEN and its reset timeout has not yet elapsed. */
    public boolean permitsProbe(String regionId) {
        return breaker(regionId).currentState() != CircuitState.OPEN;
    }

    public boolean isCandidate(String regionId) {
        return breaker(regionId).isCandidate();
    }

    public boolean tryAcquireTrial(String regionId) {
        return breaker(regionId).tryAcquireTrial();
    }

    public CircuitState state(String regionId) {
        return breaker(regionId).currentState();
    }

    public void reset(String regionId) {
        breaker(regionId).reset();
        log.info("Circuit breaker reset: region={}", regionId);
    }

    public CircuitBreakerSnapshot snapshot(String regionId) {
        return breaker(regionId).snapshot();
    }

    /** Snapshots of every breaker in catalog order. */
    public Map<String, CircuitBreakerSnapshot> snapshot() {
        Map<String, CircuitBreakerSnapshot> result = new LinkedHashMap<>();
        breakers.forEach((id, breaker) -> result.put(id, breaker.snapshot()));
        return Collections.unmodifiableMap(result);
    }

    private CircuitBreaker breaker(String regionId) {
        CircuitBreaker breaker = regionId == null ? null : breakers.get(regionId);
        if (breaker == null) {
            throw new UnknownRegionException(regionId);
        }
        return breaker;
    }

    private void onTransition(String regionId, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit breaker opened: region={}, from={}", regionId, from);
        } else {
            log.info("Circuit breaker transition: region={}, {}→{}", regionId, from, to);
        }
        Counter.builder(RoutingConstants.METRIC_CIRCUIT_TRANSITIONS)
                .tag("region", regionId)
                .tag("from", from.name().toLowerCase())
                .tag("to", to.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }
}
