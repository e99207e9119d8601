package com.waypoint.router.controller;

import com.waypoint.common.dto.RoutingDecisionResponse;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.router.routing.RegionRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/routing")
@Tag(name = "Routing", description = "Region routing decisions and real-traffic feedback")
public class RoutingController {

    private final RegionRouter regionRouter;

    public RoutingController(RegionRouter regionRouter) {
        this.regionRouter = regionRouter;
    }

    @Operation(summary = "Pick a region", description = "Returns the best eligible region for the given constraints, or 503 when none is available.")
    @GetMapping("/decision")
    public ResponseEntity<?> decide(
            @RequestParam(required = false) String country,
            @RequestParam(required = false) String capability,
            @RequestParam(required = false) String residency) {
        Optional<RegionConfig> region = regionRouter.getOptimalRegion(country, capability, residency);
        if (region.isEmpty()) {
            return ResponseEntity.status(503).body(Map.of("error", "No region available"));
        }
        return ResponseEntity.ok(toResponse(region.get()));
    }

    @Operation(summary = "Report a successful request", description = "Feeds a success into the region's circuit breaker.")
    @PostMapping("/regions/{regionId}/success")
    public ResponseEntity<Map<String, String>> recordSuccess(@PathVariable String regionId) {
        regionRouter.recordSuccess(regionId);
        return ResponseEntity.accepted().body(Map.of("regionId", regionId, "outcome", "success"));
    }

    @Operation(summary = "Report a failed request", description = "Feeds a failure into the region's circuit breaker.")
    @PostMapping("/regions/{regionId}/failure")
    public ResponseEntity<Map<String, String>> recordFailure(@PathVariable String regionId) {
        regionRouter.recordFailure(regionId);
        return ResponseEntity.accepted().body(Map.of("regionId", regionId, "outcome", "failure"));
    }

    @Operation(summary = "List active regions")
    @GetMapping("/regions")
    public ResponseEntity<List<RegionConfig>> activeRegions() {
        return ResponseEntity.ok(regionRouter.getActiveRegions());
    }

    @Operation(summary = "Get a region by id")
    @GetMapping("/regions/{regionId}")
    public ResponseEntity<?> region(@PathVariable String regionId) {
        return regionRouter.getRegionById(regionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Unknown region: " + regionId)));
    }

    private RoutingDecisionResponse toResponse(RegionConfig region) {
        RoutingDecisionResponse response = new RoutingDecisionResponse();
        response.setRegionId(region.id());
        response.setName(region.name());
        response.setProvider(region.provider());
        response.setDeploymentUrl(region.deploymentUrl());
        response.setDataResidency(region.dataResidency());
        response.setPriority(region.priority());
        response.setStrategy(regionRouter.getStrategy().value());
        response.setCircuitState(regionRouter.getCircuitState(region.id()));
        response.setDecidedAt(Instant.now());
        return response;
    }
}
