package com.competition.gateway.auth;

import com.competition.gateway.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Inbound token rejected. Always 401 with the same public message;
 * the {@link Reason} is only logged.
 */
public class AuthenticationException extends GatewayException {

    public enum Reason {
        MISSING_TOKEN,
        MALFORMED_TOKEN,
        UNKNOWN_KEY,
        INVALID_SIGNATURE,
        WRONG_ISSUER,
        WRONG_AUDIENCE,
        EXPIRED,
        NOT_YET_VALID,
        MISSING_SUBJECT,
        REVOKED
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required", message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
