package com.waypoint.router.routing;

import com.waypoint.common.constants.RoutingConstants;
import com.waypoint.common.dto.CircuitBreakerSnapshot;
import com.waypoint.common.dto.RegionHealthSnapshot;
import com.waypoint.common.model.CircuitState;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.common.model.RoutingStrategy;
import com.waypoint.router.breaker.CircuitBreakerRegistry;
import com.waypoint.router.catalog.RegionCatalog;
import com.waypoint.router.catalog.UnknownRegionException;
import com.waypoint.router.health.HealthMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the traffic-dispatch layer: routing decisions, real-traffic feedback,
 * introspection and health-check lifecycle.
 *
 * <p>All per-region state exists from construction, so decisions are safe before the first
 * health check has run.
 */
@Service
public class RegionRouter {

    private static final Logger log = LoggerFactory.getLogger(RegionRouter.class);

    private final RegionCatalog catalog;
    private final RoutingStrategyEngine engine;
    private final CircuitBreakerRegistry breakers;
    private final HealthMonitor healthMonitor;
    private final MeterRegistry meterRegistry;
    private final Counter unavailableCounter;

    public RegionRouter(RegionCatalog catalog, RoutingStrategyEngine engine, CircuitBreakerRegistry breakers,
                        HealthMonitor healthMonitor, MeterRegistry meterRegistry) {
        this.catalog = catalog;
        this.engine = engine;
        this.breakers = breakers;
        this.healthMonitor = healthMonitor;
        this.meterRegistry = meterRegistry;
        this.unavailableCounter = Counter.builder(RoutingConstants.METRIC_UNAVAILABLE)
                .description("Routing decisions with no eligible region")
                .register(meterRegistry);
        log.info("Region router initialized: regions={}, strategy={}",
                catalog.regions().size(), catalog.routingPolicy().strategy().value());
    }

    /**
     * Picks the best region for a request. Every argument may be null.
     *
     * @return the chosen region, or empty when no region is eligible
     */
    public Optional<RegionConfig> getOptimalRegion(String sourceCountry, String capability, String dataResidency) {
        return getOptimalRegion(new RoutingRequest(sourceCountry, capability, dataResidency));
    }

    public Optional<RegionConfig> getOptimalRegion(RoutingRequest request) {
        List<RegionConfig> candidates = new ArrayList<>(engine.filterCandidates(request));
        while (!candidates.isEmpty()) {
            Optional<RegionConfig> choice = engine.select(request, candidates);
            if (choice.isEmpty()) {
                break;
            }
            RegionConfig region = choice.get();
            // a concurrent decision may have taken the last HALF_OPEN trial slot
            if (breakers.tryAcquireTrial(region.id())) {
                Counter.builder(RoutingConstants.METRIC_DECISIONS)
                        .tag("region", region.id())
                        .tag("strategy", catalog.routingPolicy().strategy().value())
                        .register(meterRegistry)
                        .increment();
                log.debug("Routing decision: region={}, country={}, capability={}, residency={}",
                        region.id(), request.sourceCountry(), request.capability(), request.dataResidency());
                return Optional.of(region);
            }
            candidates.remove(region);
        }

        unavailableCounter.increment();
        log.warn("No region available: country={}, capability={}, residency={}",
                request.sourceCountry(), request.capability(), request.dataResidency());
        return Optional.empty();
    }

    public void recordSuccess(String regionId) {
        recordFeedback(regionId, true);
    }

    public void recordFailure(String regionId) {
        recordFeedback(regionId, false);
    }

    private void recordFeedback(String regionId, boolean success) {
        if (!catalog.contains(regionId)) {
            throw new UnknownRegionException(regionId);
        }
        breakers.recordOutcome(regionId, success);
        Counter.builder(RoutingConstants.METRIC_FEEDBACK)
                .tag("region", regionId)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
    }

    public Map<String, RegionHealthSnapshot> getRegionHealthStatus() {
        return healthMonitor.snapshot();
    }

    public Map<String, CircuitBreakerSnapshot> getCircuitBreakerStatus() {
        return breakers.snapshot();
    }

    public CircuitState getCircuitState(String regionId) {
        return breakers.state(regionId);
    }

    public void resetCircuitBreaker(String regionId) {
        breakers.reset(regionId);
    }

    public void startHealthChecks() {
        healthMonitor.start();
    }

    public void stopHealthChecks() {
        healthMonitor.stop();
    }

    public boolean isHealthCheckRunning() {
        return healthMonitor.isRunning();
    }

    public List<RegionConfig> getActiveRegions() {
        return catalog.activeRegions();
    }

    public Optional<RegionConfig> getRegionById(String regionId) {
        return catalog.byId(regionId);
    }

    public RoutingStrategy getStrategy() {
        return catalog.routingPolicy().strategy();
    }

    /** Regions that would pass the candidate filter for an unconstrained request. */
    public int routableRegionCount() {
        return engine.filterCandidates(RoutingRequest.any()).size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (catalog.failoverPolicy().healthCheck().enabled()) {
            startHealthChecks();
        } else {
            log.info("Health checks disabled by configuration");
        }
    }

    @PreDestroy
    public void shutdown() {
        stopHealthChecks();
    }
}
