package com.competition.gateway.exchange;

import com.competition.gateway.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Token exchange failed. The {@link Kind} decides both the HTTP status
 * surfaced to the caller and whether the call may be retried.
 */
public class TokenExchangeException extends GatewayException {

    public enum Kind {
        NETWORK_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, true),
        IDENTITY_PROVIDER_REJECTED(HttpStatus.UNAUTHORIZED, false),
        IDENTITY_PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
        MALFORMED_RESPONSE(HttpStatus.BAD_GATEWAY, false);

        private final HttpStatus status;
        private final boolean retryable;

        Kind(HttpStatus status, boolean retryable) {
            this.status = status;
            this.retryable = retryable;
        }

        public HttpStatus status() {
            return status;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Kind kind;

    public TokenExchangeException(Kind kind, String message) {
        this(kind, message, null);
    }

    public TokenExchangeException(Kind kind, String message, Throwable cause) {
        super(kind.status(), errorCode(kind), publicMessage(kind), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    private static String errorCode(Kind kind) {
        switch (kind) {
            case IDENTITY_PROVIDER_REJECTED:
                return "UNAUTHORIZED";
            case MALFORMED_RESPONSE:
                return "BAD_GATEWAY";
            default:
                return "SERVICE_UNAVAILABLE";
        }
    }

    private static String publicMessage(Kind kind) {
        switch (kind) {
            case IDENTITY_PROVIDER_REJECTED:
                return "Authentication required";
            case MALFORMED_RESPONSE:
                return "Upstream error";
            default:
                return "Service temporarily unavailable";
        }
    }
}
