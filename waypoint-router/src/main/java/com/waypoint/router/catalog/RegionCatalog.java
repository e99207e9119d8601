package com.waypoint.router.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.waypoint.common.model.FailoverPolicy;
import com.waypoint.common.model.GeoRoutingRule;
import com.waypoint.common.model.HealthEndpoint;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.common.model.RoutingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, read-only view of the region configuration document: every known region in
 * declaration order plus the global routing and failover policy.
 *
 * <p>Instances are only produced by {@link #load(Path)} or {@link #load(InputStream, String)},
 * which reject malformed documents, duplicate region ids, unknown routing strategies and missing
 * required fields with a {@link RegionCatalogException}.
 */
public final class RegionCatalog {

    private static final Logger log = LoggerFactory.getLogger(RegionCatalog.class);

    private static final ObjectMapper MAPPER = new YAMLMapper();

    private final List<RegionConfig> regions;
    private final Map<String, RegionConfig> regionsById;
    private final RoutingPolicy routingPolicy;
    private final FailoverPolicy failoverPolicy;

    private RegionCatalog(List<RegionConfig> regions, RoutingPolicy routingPolicy, FailoverPolicy failoverPolicy) {
        Map<String, RegionConfig> byId = new LinkedHashMap<>();
        for (RegionConfig region : regions) {
            byId.put(region.id(), region);
        }
        this.regions = List.copyOf(regions);
        this.regionsById = Collections.unmodifiableMap(byId);
        this.routingPolicy = routingPolicy;
        this.failoverPolicy = failoverPolicy;
    }

    public static RegionCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new RegionCatalogException("Cannot read region config " + path + ": " + e.getMessage(), e);
        }
    }

    public static RegionCatalog load(InputStream in, String source) {
        RegionsDocument document;
        try {
            document = MAPPER.readValue(in, RegionsDocument.class);
        } catch (JsonProcessingException e) {
            throw new RegionCatalogException("Malformed region config " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RegionCatalogException("Cannot read region config " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new RegionCatalogException("Region config " + source + " is empty");
        }

        FailoverPolicy failover = document.failover() == null ? FailoverPolicy.defaults() : document.failover();
        validateRegions(document.regions(), failover, source);
        validateRouting(document.routing(), document.regions(), source);
        validateFailover(failover, source);

        RegionCatalog catalog = new RegionCatalog(document.regions(), document.routing(), failover);
        log.info("Region catalog loaded: source={}, regions={}, active={}, strategy={}",
                source, catalog.regions.size(), catalog.activeRegions().size(),
                catalog.routingPolicy.strategy().value());
        return catalog;
    }

    private static void validateRegions(List<RegionConfig> regions, FailoverPolicy failover, String source) {
        if (regions == null || regions.isEmpty()) {
            throw invalid(source, "no regions declared");
        }
        List<HealthEndpoint> globalEndpoints = failover.healthCheck().endpoints();
        Map<String, RegionConfig> seen = new LinkedHashMap<>();
        for (int i = 0; i < regions.size(); i++) {
            RegionConfig region = regions.get(i);
            if (region == null) {
                throw invalid(source, "region #" + i + " is empty");
            }
            if (isBlank(region.id())) {
                throw invalid(source, "region #" + i + " is missing 'id'");
            }
            if (seen.put(region.id(), region) != null) {
                throw invalid(source, "duplicate region id '" + region.id() + "'");
            }
            if (region.status() == null) {
                throw invalid(source, "region '" + region.id() + "' is missing 'status'");
            }
            if (!region.isActive()) {
                continue;
            }
            if (isBlank(region.deploymentUrl())) {
                throw invalid(source, "active region '" + region.id() + "' is missing 'deployment_url'");
            }
            List<HealthEndpoint> endpoints = region.healthEndpoints().isEmpty() ? globalEndpoints : region.healthEndpoints();
            if (endpoints.isEmpty()) {
                throw invalid(source, "active region '" + region.id() + "' has no health endpoints");
            }
            for (HealthEndpoint endpoint : endpoints) {
                if (endpoint == null || isBlank(endpoint.path())) {
                    throw invalid(source, "region '" + region.id() + "' declares a health endpoint without 'path'");
                }
                if (endpoint.expectedStatus() < 100 || endpoint.expectedStatus() > 599) {
                    throw invalid(source, "region '" + region.id() + "' expects invalid status " + endpoint.expectedStatus());
                }
            }
        }
    }

    private static void validateRouting(RoutingPolicy routing, List<RegionConfig> regions, String source) {
        if (routing == null) {
            throw invalid(source, "missing 'routing' block");
        }
        if (routing.strategy() == null) {
            throw invalid(source, "missing 'routing.strategy'");
        }
        List<String> ids = regions.stream().map(RegionConfig::id).toList();
        for (GeoRoutingRule rule : routing.geoRules()) {
            if (rule == null || rule.sourceCountries().isEmpty()) {
                throw invalid(source, "geo rule without 'source_country'");
            }
            if (!ids.contains(rule.targetRegionId())) {
                throw invalid(source, "geo rule targets unknown region '" + rule.targetRegionId() + "'");
            }
            if (rule.fallbackRegionId() != null && !ids.contains(rule.fallbackRegionId())) {
                throw invalid(source, "geo rule falls back to unknown region '" + rule.fallbackRegionId() + "'");
            }
        }
        RoutingPolicy.LatencyThresholds thresholds = routing.latencyThresholds();
        if (thresholds.warnMs() < 0 || thresholds.criticalMs() < thresholds.warnMs()) {
            throw invalid(source, "latency thresholds must satisfy 0 <= warn <= critical");
        }
    }

    private static void validateFailover(FailoverPolicy failover, String source) {
        FailoverPolicy.HealthCheckSettings health = failover.healthCheck();
        requirePositive(source, "failover.health_check.interval_seconds", health.intervalSeconds());
        requirePositive(source, "failover.health_check.timeout_seconds", health.timeoutSeconds());
        requirePositive(source, "failover.health_check.unhealthy_threshold", health.unhealthyThreshold());
        requirePositive(source, "failover.health_check.healthy_threshold", health.healthyThreshold());

        FailoverPolicy.CircuitBreakerSettings breaker = failover.circuitBreaker();
        requirePositive(source, "failover.circuit_breaker.failure_threshold", breaker.failureThreshold());
        requirePositive(source, "failover.circuit_breaker.success_threshold", breaker.successThreshold());
        requirePositive(source, "failover.circuit_breaker.timeout_seconds", breaker.resetTimeoutSeconds());
        requirePositive(source, "failover.circuit_breaker.half_open_requests", breaker.halfOpenRequests());

        FailoverPolicy.AutomaticFailoverSettings automatic = failover.automaticFailover();
        requirePositive(source, "failover.automatic_failover.max_failover_time_seconds", automatic.maxFailoverTimeSeconds());
        if (automatic.errorRateThreshold() <= 0 || automatic.errorRateThreshold() > 1) {
            throw invalid(source, "failover.automatic_failover.error_rate_threshold must be in (0, 1]");
        }
        if (automatic.latencyP95ThresholdMs() <= 0) {
            throw invalid(source, "failover.automatic_failover.latency_p95_threshold must be positive");
        }

        long detectionSeconds = (long) health.intervalSeconds() * health.unhealthyThreshold();
        if (automatic.enabled() && detectionSeconds > automatic.maxFailoverTimeSeconds()) {
            log.warn("Failure detection takes up to {}s (interval={}s x unhealthy_threshold={}), above max_failover_time_seconds={}",
                    detectionSeconds, health.intervalSeconds(), health.unhealthyThreshold(),
                    automatic.maxFailoverTimeSeconds());
        }
    }

    private static void requirePositive(String source, String field, int value) {
        if (value <= 0) {
            throw invalid(source, field + " must be positive, got " + value);
        }
    }

    private static RegionCatalogException invalid(String source, String reason) {
        return new RegionCatalogException("Invalid region config " + source + ": " + reason);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** All configured regions in declaration order. */
    public List<RegionConfig> regions() {
        return regions;
    }

    public List<RegionConfig> activeRegions() {
        return regions.stream().filter(RegionConfig::isActive).toList();
    }

    public Optional<RegionConfig> byId(String regionId) {
        return Optional.ofNullable(regionId == null ? null : regionsById.get(regionId));
    }

    public RegionConfig require(String regionId) {
        return byId(regionId).orElseThrow(() -> new UnknownRegionException(regionId));
    }

    public boolean contains(String regionId) {
        return regionId != null && regionsById.containsKey(regionId);
    }

    public RoutingPolicy routingPolicy() {
        return routingPolicy;
    }

    public FailoverPolicy failoverPolicy() {
        return failoverPolicy;
    }

    /** Region-level endpoints when declared, otherwise the global health-check endpoints. */
    public List<HealthEndpoint> healthEndpointsFor(RegionConfig region) {
        return region.healthEndpoints().isEmpty()
                ? failoverPolicy.healthCheck().endpoints()
                : region.healthEndpoints();
    }
}
