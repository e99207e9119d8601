package com.waypoint.router.latency;

import com.waypoint.common.constants.RoutingConstants;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.router.catalog.RegionCatalog;
import com.waypoint.router.catalog.UnknownRegionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Rolling per-region window of probe latencies. Percentiles are computed on read from a sorted
 * copy of the window, so readers never hold the window while sorting.
 */
@Component
public class LatencyTracker {

    private final int capacity;
    private final Map<String, LatencyWindow> windows;

    @Autowired
    public LatencyTracker(RegionCatalog catalog) {
        this(catalog, RoutingConstants.LATENCY_WINDOW_SIZE);
    }

    public LatencyTracker(RegionCatalog catalog, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Latency window capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        Map<String, LatencyWindow> byRegion = new LinkedHashMap<>();
        for (RegionConfig region : catalog.regions()) {
            byRegion.put(region.id(), new LatencyWindow(capacity));
        }
        this.windows = Collections.unmodifiableMap(byRegion);
    }

    public void record(String regionId, long latencyMs) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("Latency must not be negative: " + latencyMs);
        }
        window(regionId).record(latencyMs);
    }

    /** 95th percentile of the current window, or empty when no sample has been recorded yet. */
    public OptionalLong p95(String regionId) {
        return percentile(regionId, RoutingConstants.LATENCY_PERCENTILE);
    }

    public OptionalLong percentile(String regionId, double percentile) {
        long[] samples = window(regionId).snapshot();
        if (samples.length == 0) {
            return OptionalLong.empty();
        }
        Arrays.sort(samples);
        return OptionalLong.of(samples[RoutingConstants.percentileIndex(samples.length, percentile)]);
    }

    public int sampleCount(String regionId) {
        return window(regionId).size();
    }

    public int capacity() {
        return capacity;
    }

    private LatencyWindow window(String regionId) {
        LatencyWindow window = windows.get(regionId);
        if (window == null) {
            throw new UnknownRegionException(regionId);
        }
        return window;
    }
}
