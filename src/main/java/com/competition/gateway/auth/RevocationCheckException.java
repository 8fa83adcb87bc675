package com.competition.gateway.auth;

import com.competition.gateway.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Revocation store unreachable; the check fails closed.
 */
public class RevocationCheckException extends GatewayException {

    public RevocationCheckException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE", "Service temporarily unavailable",
            message, cause);
    }
}
