package com.waypoint.router.routing;

/**
 * Caller-supplied routing constraints. Blank values are treated as absent.
 */
public record RoutingRequest(String sourceCountry, String capability, String dataResidency) {

    public RoutingRequest {
        sourceCountry = blankToNull(sourceCountry);
        capability = blankToNull(capability);
        dataResidency = blankToNull(dataResidency);
    }

    public static RoutingRequest any() {
        return new RoutingRequest(null, null, null);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
