package com.waypoint.router.routing;

import com.waypoint.common.model.GeoRoutingRule;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.common.model.RoutingPolicy;
import com.waypoint.router.breaker.CircuitBreakerRegistry;
import com.waypoint.router.catalog.RegionCatalog;
import com.waypoint.router.health.HealthMonitor;
import com.waypoint.router.latency.LatencyTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Filters the catalog down to eligible regions and lets the configured strategy pick one.
 *
 * <p>Filter order: active status, capability, data residency, breaker not OPEN (HALF_OPEN only
 * while a trial slot is free), healthy. With automatic failover enabled, regions that are
 * degraded on sustained evidence (see {@link HealthMonitor#isDegraded}) are then dropped unless
 * that would leave nothing. All filtering keeps catalog order, so every
 * strategy breaks ties by declaration order.
 */
@Component
public class RoutingStrategyEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingStrategyEngine.class);

    private final RegionCatalog catalog;
    private final CircuitBreakerRegistry breakers;
    private final HealthMonitor healthMonitor;
    private final LatencyTracker latencyTracker;

    public RoutingStrategyEngine(RegionCatalog catalog, CircuitBreakerRegistry breakers,
                                 HealthMonitor healthMonitor, LatencyTracker latencyTracker) {
        this.catalog = catalog;
        this.breakers = breakers;
        this.healthMonitor = healthMonitor;
        this.latencyTracker = latencyTracker;
    }

    public List<RegionConfig> filterCandidates(RoutingRequest request) {
        List<RegionConfig> candidates = new ArrayList<>();
        for (RegionConfig region : catalog.regions()) {
            if (!region.isActive()) continue;
            if (request.capability() != null && !region.hasCapability(request.capability())) continue;
            if (request.dataResidency() != null && !region.residesIn(request.dataResidency())) continue;
            if (!breakers.isCandidate(region.id())) continue;
            if (!healthMonitor.isHealthy(region.id())) continue;
            candidates.add(region);
        }
        return demoteDegraded(candidates);
    }

    private List<RegionConfig> demoteDegraded(List<RegionConfig> candidates) {
        if (!catalog.failoverPolicy().automaticFailover().enabled() || candidates.size() < 2) {
            return candidates;
        }
        List<RegionConfig> preferred = candidates.stream()
                .filter(r -> !healthMonitor.isDegraded(r.id()))
                .toList();
        if (preferred.isEmpty()) {
            log.debug("All {} candidates degraded, keeping them", candidates.size());
            return candidates;
        }
        if (preferred.size() < candidates.size()) {
            log.debug("Demoted degraded regions: kept={}, dropped={}", preferred.size(), candidates.size() - preferred.size());
        }
        return new ArrayList<>(preferred);
    }

    /** Applies the configured strategy to an already-filtered candidate list. */
    public Optional<RegionConfig> select(RoutingRequest request, List<RegionConfig> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        RoutingPolicy policy = catalog.routingPolicy();
        return switch (policy.strategy()) {
            case GEO_BASED -> Optional.of(selectByGeo(policy, request.sourceCountry(), candidates));
            case LATENCY_BASED -> candidates.stream().min(Comparator.comparingLong(this::latencyOrMax));
            case PRIORITY_BASED -> candidates.stream().min(Comparator.comparingInt(RegionConfig::priority));
        };
    }

    public Optional<RegionConfig> decide(RoutingRequest request) {
        return select(request, filterCandidates(request));
    }

    private RegionConfig selectByGeo(RoutingPolicy policy, String sourceCountry, List<RegionConfig> candidates) {
        for (GeoRoutingRule rule : policy.geoRules()) {
            if (!rule.matches(sourceCountry)) continue;
            Optional<RegionConfig> target = find(candidates, rule.targetRegionId());
            if (target.isPresent()) {
                return target.get();
            }
            Optional<RegionConfig> fallback = find(candidates, rule.fallbackRegionId());
            if (fallback.isPresent()) {
                log.debug("Geo rule fell back: country={}, target={}, fallback={}",
                        sourceCountry, rule.targetRegionId(), rule.fallbackRegionId());
                return fallback.get();
            }
            break;
        }
        return candidates.get(0);
    }

    private long latencyOrMax(RegionConfig region) {
        return latencyTracker.p95(region.id()).orElse(Long.MAX_VALUE);
    }

    private static Optional<RegionConfig> find(List<RegionConfig> candidates, String regionId) {
        if (regionId == null) {
            return Optional.empty();
        }
        return candidates.stream().filter(r -> r.id().equals(regionId)).findFirst();
    }
}
