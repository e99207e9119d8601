package com.waypoint.router.config;

import com.waypoint.common.constants.RoutingConstants;
import com.waypoint.router.catalog.RegionCatalog;
import com.waypoint.router.catalog.RegionCatalogException;
import com.waypoint.router.health.HealthProbeClient;
import com.waypoint.router.health.HttpHealthProbeClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

@Configuration
public class RouterConfig {

    @Bean
    public RegionCatalog regionCatalog(
            ResourceLoader resourceLoader,
            @Value("${waypoint.regions-config:" + RoutingConstants.DEFAULT_REGIONS_CONFIG + "}") String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RegionCatalogException("Region config not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return RegionCatalog.load(in, location);
        } catch (IOException e) {
            throw new RegionCatalogException("Cannot read region config " + location + ": " + e.getMessage(), e);
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HealthProbeClient healthProbeClient(RegionCatalog catalog) {
        return new HttpHealthProbeClient(catalog.failoverPolicy().healthCheck().timeout());
    }

    @Bean
    public ThreadPoolTaskScheduler healthCheckScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("health-check-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /** Probe threads; {@code 0} sizes the pool to one thread per active region. */
    @Bean
    public ThreadPoolTaskExecutor healthProbeExecutor(
            RegionCatalog catalog,
            @Value("${waypoint.health.probe-threads:0}") int probeThreads) {
        int threads = probeThreads > 0 ? probeThreads : Math.max(1, catalog.activeRegions().size());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(catalog.regions().size());
        executor.setThreadNamePrefix("health-probe-");
        return executor;
    }
}
