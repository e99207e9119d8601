package com.waypoint.router.catalog;

public class UnknownRegionException extends RuntimeException {

    private final String regionId;

    public UnknownRegionException(String regionId) {
        super("Unknown region: " + regionId);
        this.regionId = regionId;
    }

    public String getRegionId() {
        return regionId;
    }
}
