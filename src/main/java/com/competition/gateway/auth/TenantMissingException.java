package com.competition.gateway.auth;

import com.competition.gateway.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Token is valid but carries no tenant claim.
 */
public class TenantMissingException extends GatewayException {

    public TenantMissingException(String subject) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", "Access denied",
            "Authenticated subject " + subject + " has no tenant claim", null);
    }
}
