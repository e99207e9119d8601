package com.waypoint.router.controller;

import com.waypoint.common.dto.CircuitBreakerSnapshot;
import com.waypoint.common.dto.RegionHealthSnapshot;
import com.waypoint.router.routing.RegionRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/regions/status")
@Tag(name = "Region status", description = "Health, circuit breaker state and health-check control")
public class RegionStatusController {

    private final RegionRouter regionRouter;

    public RegionStatusController(RegionRouter regionRouter) {
        this.regionRouter = regionRouter;
    }

    @Operation(summary = "Region health", description = "Health snapshot per region, in configuration order.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, RegionHealthSnapshot>> health() {
        return ResponseEntity.ok(regionRouter.getRegionHealthStatus());
    }

    @Operation(summary = "Circuit breakers", description = "Circuit breaker snapshot per region, in configuration order.")
    @GetMapping("/circuit-breakers")
    public ResponseEntity<Map<String, CircuitBreakerSnapshot>> circuitBreakers() {
        return ResponseEntity.ok(regionRouter.getCircuitBreakerStatus());
    }

    @Operation(summary = "Reset a circuit breaker", description = "Forces the region's breaker back to CLOSED.")
    @PostMapping("/circuit-breakers/{regionId}/reset")
    public ResponseEntity<Map<String, Object>> resetCircuitBreaker(@PathVariable String regionId) {
        regionRouter.resetCircuitBreaker(regionId);
        return ResponseEntity.ok(Map.of("regionId", regionId, "state", regionRouter.getCircuitState(regionId)));
    }

    @GetMapping("/health-checks")
    public ResponseEntity<Map<String, Boolean>> healthChecks() {
        return ResponseEntity.ok(Map.of("running", regionRouter.isHealthCheckRunning()));
    }

    @Operation(summary = "Start health checks")
    @PostMapping("/health-checks/start")
    public ResponseEntity<Map<String, Boolean>> startHealthChecks() {
        regionRouter.startHealthChecks();
        return ResponseEntity.ok(Map.of("running", regionRouter.isHealthCheckRunning()));
    }

    @Operation(summary = "Stop health checks")
    @PostMapping("/health-checks/stop")
    public ResponseEntity<Map<String, Boolean>> stopHealthChecks() {
        regionRouter.stopHealthChecks();
        return ResponseEntity.ok(Map.of("running", regionRouter.isHealthCheckRunning()));
    }
}
