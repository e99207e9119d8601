package com.waypoint.router.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.common.model.FailoverPolicy;
import com.waypoint.common.model.RegionConfig;
import com.waypoint.common.model.RoutingPolicy;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record RegionsDocument(
        @JsonProperty("regions") List<RegionConfig> regions,
        @JsonProperty(value = "routing", required = true) RoutingPolicy routing,
        @JsonProperty("failover") FailoverPolicy failover
) {}
