package com.waypoint.router.catalog;

/**
 * Raised when the region configuration cannot be read or fails validation. The router must
 * not start on a partially valid catalog, so this is never caught inside the engine.
 */
public class RegionCatalogException extends RuntimeException {

    public RegionCatalogException(String message) {
        super(message);
    }

    public RegionCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
