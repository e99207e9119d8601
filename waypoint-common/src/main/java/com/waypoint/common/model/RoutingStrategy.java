package com.waypoint.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum RoutingStrategy {
    GEO_BASED("geo-based"),
    LATENCY_BASED("latency-based"),
    PRIORITY_BASED("priority-based");

    private final String value;

    RoutingStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RoutingStrategy fromValue(String value) {
        if (value != null) {
            for (RoutingStrategy strategy : values()) {
                if (strategy.value.equalsIgnoreCase(value.trim())) {
                    return strategy;
                }
            }
        }
        String known = Arrays.stream(values()).map(RoutingStrategy::value).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unknown routing strategy '" + value + "', expected one of: " + known);
    }
}
