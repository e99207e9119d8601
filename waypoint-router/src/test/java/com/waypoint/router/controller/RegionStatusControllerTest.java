package com.waypoint.router.controller;

import com.waypoint.common.dto.CircuitBreakerSnapshot;
import com.waypoint.common.dto.RegionHealthSnapshot;
import com.waypoint.common.model.CircuitState;
import com.waypoint.common.model.LatencyLevel;
import com.waypoint.router.catalog.UnknownRegionException;
import com.waypoint.router.config.SecurityConfig;
import com.waypoint.router.routing.RegionRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RegionStatusController.class)
@Import(SecurityConfig.class)
class RegionStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegionRouter regionRouter;

    private static final String AUTH_HEADER = "Bearer test-token";

    @Test
    void health_returnsSnapshotPerRegion() throws Exception {
        when(regionRouter.getRegionHealthStatus()).thenReturn(Map.of("us-east-1",
                new RegionHealthSnapshot("us-east-1", false, 3, 0, Instant.parse("2024-01-01T00:00:00Z"),
                        120L, 0.25, LatencyLevel.OK, false, Boolean.TRUE)));

        mockMvc.perform(get("/api/v1/regions/status/health")
                        .header("Authorization", AUTH_HEADER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['us-east-1'].healthy").value(false))
                .andExpect(jsonPath("$['us-east-1'].consecutiveFailures").value(3))
                .andExpect(jsonPath("$['us-east-1'].latencyP95Ms").value(120));
    }

    @Test
    void circuitBreakers_returnsSnapshotPerRegion() throws Exception {
        when(regionRouter.getCircuitBreakerStatus()).thenReturn(Map.of("eu-west-1",
                new CircuitBreakerSnapshot("eu-west-1", CircuitState.OPEN, 5, 0, null, null, 0)));

        mockMvc.perform(get("/api/v1/regions/status/circuit-breakers")
                        .header("Authorization", AUTH_HEADER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['eu-west-1'].state").value("OPEN"))
                .andExpect(jsonPath("$['eu-west-1'].failureCount").value(5));
    }

    @Test
    void resetCircuitBreaker_returns404_forUnknownRegion() throws Exception {
        doThrow(new UnknownRegionException("mars-1")).when(regionRouter).resetCircuitBreaker("mars-1");

        mockMvc.perform(post("/api/v1/regions/status/circuit-breakers/mars-1/reset")
                        .header("Authorization", AUTH_HEADER))
                .andExpect(status().isNotFound());
    }

    @Test
    void startHealthChecks_reportsRunning() throws Exception {
        when(regionRouter.isHealthCheckRunning()).thenReturn(true);

        mockMvc.perform(post("/api/v1/regions/status/health-checks/start")
                        .header("Authorization", AUTH_HEADER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true));

        verify(regionRouter).startHealthChecks();
    }

    @Test
    void stopHealthChecks_reportsStopped() throws Exception {
        when(regionRouter.isHealthCheckRunning()).thenReturn(false);

        mockMvc.perform(post("/api/v1/regions/status/health-checks/stop")
                        .header("Authorization", AUTH_HEADER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false));

        verify(regionRouter).stopHealthChecks();
    }

    @Test
    void health_returns401_withoutAuth() throws Exception {
        mockMvc.perform(get("/api/v1/regions/status/health"))
                .andExpect(status().isUnauthorized());
    }
}
