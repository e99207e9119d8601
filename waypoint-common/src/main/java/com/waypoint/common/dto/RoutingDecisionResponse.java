package com.waypoint.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.waypoint.common.model.CircuitState;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutingDecisionResponse {

    private String regionId;
    private String name;
    private String provider;
    private String deploymentUrl;
    private String dataResidency;
    private int priority;
    private String strategy;
    private CircuitState circuitState;
    private Instant decidedAt;

    public RoutingDecisionResponse() {}

    public String getRegionId() { return regionId; }
    public void setRegionId(String regionId) { this.regionId = regionId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getDeploymentUrl() { return deploymentUrl; }
    public void setDeploymentUrl(String deploymentUrl) { this.deploymentUrl = deploymentUrl; }
    public String getDataResidency() { return dataResidency; }
    public void setDataResidency(String dataResidency) { this.dataResidency = dataResidency; }
    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }
    public CircuitState getCircuitState() { return circuitState; }
    public void setCircuitState(CircuitState circuitState) { this.circuitState = circuitState; }
    public Instant getDecidedAt() { return decidedAt; }
    public void setDecidedAt(Instant decidedAt) { this.decidedAt = decidedAt; }
}
