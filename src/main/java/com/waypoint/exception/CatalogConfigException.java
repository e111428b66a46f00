package com.waypoint.exception;

/**
 * Raised when the curriculum document cannot be loaded into a valid catalog.
 * <p>
 * No catalog state is published when this is thrown, so a later access retries the load from scratch.
 * </p>
 */
public class CatalogConfigException extends RuntimeException {

    public CatalogConfigException(String message) {
        super(message);
    }

    public CatalogConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
