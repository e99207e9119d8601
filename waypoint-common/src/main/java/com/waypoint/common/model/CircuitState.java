package com.waypoint.common.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
