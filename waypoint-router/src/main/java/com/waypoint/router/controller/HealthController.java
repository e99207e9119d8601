package com.waypoint.router.controller;

import com.waypoint.router.routing.RegionRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Health", description = "Service health")
public class HealthController {

    private final RegionRouter regionRouter;

    public HealthController(RegionRouter regionRouter) {
        this.regionRouter = regionRouter;
    }

    @Operation(summary = "Health check", description = "Returns 200 if at least one region can take traffic, 503 otherwise.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        int routable = regionRouter.routableRegionCount();
        boolean up = routable > 0;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", up ? "UP" : "DEGRADED");
        result.put("routableRegions", routable);
        result.put("activeRegions", regionRouter.getActiveRegions().size());
        result.put("healthChecksRunning", regionRouter.isHealthCheckRunning());
        return up ? ResponseEntity.ok(result)
                  : ResponseEntity.status(503).body(result);
    }
}
