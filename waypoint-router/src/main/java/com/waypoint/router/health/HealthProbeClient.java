package com.waypoint.router.health;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Issues one synthetic GET against a region's health endpoint and reports the HTTP status.
 */
@FunctionalInterface
public interface HealthProbeClient {

    int fetchStatus(URI uri, Duration timeout) throws IOException, InterruptedException;
}
