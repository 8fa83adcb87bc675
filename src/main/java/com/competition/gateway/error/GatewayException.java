package com.competition.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures that end a request with a gateway-generated response.
 *
 * <p>The message is for logs only. Callers see {@link #getErrorCode()} and
 * {@link #getPublicMessage()}, which never carry internal detail.
 */
public abstract class GatewayException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;
    private final String publicMessage;

    protected GatewayException(HttpStatus status, String errorCode, String publicMessage,
                               String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
        this.publicMessage = publicMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getPublicMessage() {
        return publicMessage;
    }
}
