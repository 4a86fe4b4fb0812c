package com.routeops.api.services;

/**
 * Thrown when a route id does not match any row.
 */
public class RouteNotFoundException extends RuntimeException {

    private final String routeId;

    public RouteNotFoundException(String routeId) {
        super("Route not found: " + routeId);
        this.routeId = routeId;
    }

    public String getRouteId() {
        return routeId;
    }
}
