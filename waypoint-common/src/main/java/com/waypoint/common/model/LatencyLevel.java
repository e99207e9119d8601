package com.waypoint.common.model;

public enum LatencyLevel {
    UNKNOWN,
    OK,
    WARN,
    CRITICAL
}
