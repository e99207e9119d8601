package com.waypoint.router.health;

import com.waypoint.common.constants.RoutingConstants;
import com.waypoint.common.dto.RegionHealthSnapshot;
import com.waypoint.common.model.FailoverPolicy.AutomaticFailoverSettings;
import com.waypoint.common.model.FailoverPolicy.HealthCheckSettings;
import com.waypoint.common.model.HealthEndpoint;
import com.waypoint.common.model.LatencyLevel;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.common.model.RoutingPolicy.LatencyThresholds;
import com.waypoint.router.breaker.CircuitBreakerRegistry;
import com.waypoint.router.catalog.RegionCatalog;
import com.waypoint.router.catalog.UnknownRegionException;
import com.waypoint.router.latency.LatencyTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically probes every active region's health endpoints and keeps a hysteresis-smoothed
 * healthy flag per region.
 *
 * <p>A round is scheduled at a fixed rate on the {@code healthCheckScheduler}; each region's
 * probe runs on the {@code healthProbeExecutor}, so one slow region never delays another. A
 * region whose previous probe is still in flight is skipped for that tick, and a region whose
 * breaker is OPEN and not yet due for a retry is not probed at all.
 *
 * <p>Every probe outcome is also reported to the region's circuit breaker.
 */
@Component
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final RegionCatalog catalog;
    private final HealthProbeClient probeClient;
    private final LatencyTracker latencyTracker;
    private final CircuitBreakerRegistry breakers;
    private final TaskScheduler scheduler;
    private final Executor probeExecutor;
    private final Clock clock;
    private final HealthCheckSettings settings;

    private final Map<String, RegionHealthState> states;
    private final Map<String, AtomicBoolean> inFlight;
    private final Map<String, Timer> probeTimers = new LinkedHashMap<>();
    private final Map<String, Counter> probeFailures = new LinkedHashMap<>();

    private ScheduledFuture<?> scheduledRound;

    public HealthMonitor(
            RegionCatalog catalog,
            HealthProbeClient probeClient,
            LatencyTracker latencyTracker,
            CircuitBreakerRegistry breakers,
            @Qualifier("healthCheckScheduler") TaskScheduler scheduler,
            @Qualifier("healthProbeExecutor") Executor probeExecutor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.catalog = catalog;
        this.probeClient = probeClient;
        this.latencyTracker = latencyTracker;
        this.breakers = breakers;
        this.scheduler = scheduler;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.settings = catalog.failoverPolicy().healthCheck();

        Map<String, RegionHealthState> byRegion = new LinkedHashMap<>();
        Map<String, AtomicBoolean> flags = new LinkedHashMap<>();
        for (RegionConfig region : catalog.regions()) {
            RegionHealthState state = new RegionHealthState(region.id(), RoutingConstants.LATENCY_WINDOW_SIZE);
            byRegion.put(region.id(), state);
            flags.put(region.id(), new AtomicBoolean(false));

            Gauge.builder(RoutingConstants.METRIC_REGION_HEALTHY, state, s -> s.isHealthy() ? 1 : 0)
                    .tag("region", region.id())
                    .register(meterRegistry);
            probeTimers.put(region.id(), Timer.builder(RoutingConstants.METRIC_PROBE_LATENCY)
                    .tag("region", region.id())
                    .register(meterRegistry));
            probeFailures.put(region.id(), Counter.builder(RoutingConstants.METRIC_PROBE_FAILURES)
                    .tag("region", region.id())
                    .register(meterRegistry));
        }
        this.states = Collections.unmodifiableMap(byRegion);
        this.inFlight = Collections.unmodifiableMap(flags);
    }

    /**
     * Probes every health endpoint of {@code region} in order, failing the round on the first
     * endpoint that answers with an unexpected status, errors or times out.
     *
     * @return whether the whole round succeeded
     */
    public boolean probeOnce(RegionConfig region) {
        RegionHealthState state = state(region.id());
        MDC.put("regionId", region.id());
        try {
            List<Long> latencies = new ArrayList<>();
            boolean success = probeEndpoints(region, latencies);

            if (success) {
                Timer timer = probeTimers.get(region.id());
                for (long latencyMs : latencies) {
                    latencyTracker.record(region.id(), latencyMs);
                    timer.record(latencyMs, TimeUnit.MILLISECONDS);
                }
            } else {
                probeFailures.get(region.id()).increment();
            }

            RegionHealthState.Transition transition = state.recordProbe(success, clock.instant(),
                    settings.unhealthyThreshold(), settings.healthyThreshold());
            if (transition == RegionHealthState.Transition.FAILED) {
                log.warn("Region marked unhealthy: region={}, consecutiveFailures={}",
                        region.id(), settings.unhealthyThreshold());
            } else if (transition == RegionHealthState.Transition.RECOVERED) {
                log.info("Region recovered: region={}, consecutiveSuccesses={}",
                        region.id(), settings.healthyThreshold());
            }

            updateLatencyLevel(region, state);
            breakers.recordOutcome(region.id(), success);
            return success;
        } finally {
            MDC.remove("regionId");
        }
    }

    private boolean probeEndpoints(RegionConfig region, List<Long> latencies) {
        List<HealthEndpoint> endpoints = catalog.healthEndpointsFor(region);
        if (region.deploymentUrl() == null || endpoints.isEmpty()) {
            log.warn("Probe skipped, region has no probe target: region={}", region.id());
            return false;
        }
        String base = stripTrailingSlash(region.deploymentUrl());
        Duration timeout = settings.timeout();

        for (HealthEndpoint endpoint : endpoints) {
            String target = base + endpoint.path();
            long startNanos = System.nanoTime();
            try {
                int status = probeClient.fetchStatus(URI.create(target), timeout);
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                if (status != endpoint.expectedStatus()) {
                    log.warn("Probe failed: region={}, url={}, status={}, expected={}",
                            region.id(), target, status, endpoint.expectedStatus());
                    return false;
                }
                latencies.add(elapsedMs);
                log.debug("Probe ok: region={}, url={}, latencyMs={}", region.id(), target, elapsedMs);
            } catch (IOException e) {
                log.warn("Probe failed: region={}, url={}, error={}", region.id(), target, e.toString());
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Probe interrupted: region={}, url={}", region.id(), target);
                return false;
            } catch (RuntimeException e) {
                log.warn("Probe error: region={}, url={}", region.id(), target, e);
                return false;
            }
        }
        return true;
    }

    private void updateLatencyLevel(RegionConfig region, RegionHealthState state) {
        LatencyThresholds thresholds = catalog.routingPolicy().latencyThresholds();
        OptionalLong p95 = latencyTracker.p95(region.id());
        LatencyLevel level = p95.isPresent() ? thresholds.classify(p95.getAsLong()) : LatencyLevel.UNKNOWN;
        LatencyLevel previous = state.updateLatencyLevel(level);
        if (previous == level) {
            return;
        }
        if (level == LatencyLevel.CRITICAL) {
            log.warn("Latency level changed: region={}, {}→{}, p95Ms={}", region.id(), previous, level, p95.getAsLong());
        } else if (p95.isPresent()) {
            log.info("Latency level changed: region={}, {}→{}, p95Ms={}", region.id(), previous, level, p95.getAsLong());
        }
    }

    /** One scheduled tick: hands each eligible active region's probe to the probe executor. */
    public void runRound() {
        for (RegionConfig region : catalog.activeRegions()) {
            if (!breakers.permitsProbe(region.id())) {
                log.debug("Probe skipped, circuit open: region={}", region.id());
                continue;
            }
            AtomicBoolean running = inFlight.get(region.id());
            if (!running.compareAndSet(false, true)) {
                log.debug("Probe skipped, previous probe still running: region={}", region.id());
                continue;
            }
            try {
                probeExecutor.execute(() -> {
                    try {
                        probeOnce(region);
                    } catch (RuntimeException e) {
                        log.error("Health probe crashed: region={}", region.id(), e);
                    } finally {
                        running.set(false);
                    }
                });
            } catch (RejectedExecutionException e) {
                running.set(false);
                log.warn("Probe rejected by executor: region={}, error={}", region.id(), e.getMessage());
            }
        }
    }

    public synchronized void start() {
        start(settings.interval());
    }

    public synchronized void start(Duration interval) {
        if (scheduledRound != null) {
            log.debug("Health checks already running");
            return;
        }
        scheduledRound = scheduler.scheduleAtFixedRate(this::runRound, interval);
        log.info("Health checks started: interval={}s, regions={}", interval.toSeconds(), catalog.activeRegions().size());
    }

    public synchronized void stop() {
        if (scheduledRound == null) {
            return;
        }
        scheduledRound.cancel(false);
        scheduledRound = null;
        log.info("Health checks stopped");
    }

    public synchronized boolean isRunning() {
        return scheduledRound != null;
    }

    public boolean isHealthy(String regionId) {
        return state(regionId).isHealthy();
    }

    /**
     * True when automatic failover is enabled and the region has breached its latency or error
     * budget on sustained evidence: at least {@link RoutingConstants#DEGRADATION_MIN_SAMPLES}
     * latency samples for the p95 check, and as many probe rounds with at least
     * {@code unhealthy_threshold} failures among them for the error-rate check.
     */
    public boolean isDegraded(String regionId) {
        AutomaticFailoverSettings failover = catalog.failoverPolicy().automaticFailover();
        if (!failover.enabled()) {
            return false;
        }
        RegionHealthState state = state(regionId);
        return isSlow(regionId, failover)
                || state.errorRateBreached(failover.errorRateThreshold(),
                        RoutingConstants.DEGRADATION_MIN_SAMPLES, settings.unhealthyThreshold());
    }

    private boolean isSlow(String regionId, AutomaticFailoverSettings failover) {
        if (latencyTracker.sampleCount(regionId) < RoutingConstants.DEGRADATION_MIN_SAMPLES) {
            return false;
        }
        OptionalLong p95 = latencyTracker.p95(regionId);
        return p95.isPresent() && p95.getAsLong() > failover.latencyP95ThresholdMs();
    }

    /** Copies of every region's health record in catalog order. */
    public Map<String, RegionHealthSnapshot> snapshot() {
        Map<String, RegionHealthSnapshot> result = new LinkedHashMap<>();
        for (RegionConfig region : catalog.regions()) {
            OptionalLong p95 = latencyTracker.p95(region.id());
            Long p95Ms = p95.isPresent() ? p95.getAsLong() : null;
            Boolean meetsTarget = p95Ms == null || region.latencyTargetP95Ms() == null
                    ? null
                    : p95Ms <= region.latencyTargetP95Ms();
            result.put(region.id(), states.get(region.id()).snapshot(p95Ms, isDegraded(region.id()), meetsTarget));
        }
        return Collections.unmodifiableMap(result);
    }

    private RegionHealthState state(String regionId) {
        RegionHealthState state = regionId == null ? null : states.get(regionId);
        if (state == null) {
            throw new UnknownRegionException(regionId);
        }
        return state;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
