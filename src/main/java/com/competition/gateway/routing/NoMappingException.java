package com.competition.gateway.routing;

import com.competition.gateway.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Route has no audience mapping and the unmapped-route policy is {@link UnmappedRoutePolicy#REJECT}.
 */
public class NoMappingException extends GatewayException {

    private final String routeId;

    public NoMappingException(String routeId, HttpStatus status) {
        super(status, status == HttpStatus.NOT_IMPLEMENTED ? "NOT_IMPLEMENTED" : "NOT_FOUND",
            status == HttpStatus.NOT_IMPLEMENTED ? "Route not available" : "Route not found",
            "No audience mapping for route " + routeId, null);
        this.routeId = routeId;
    }

    public String getRouteId() {
        return routeId;
    }
}
