package com.competition.gateway.error;

import com.competition.gateway.auth.AuthenticationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Turns pipeline failures into HTTP responses.
 *
 * <p>The body is always {@code {"error": CODE, "message": generic text}}. Details stay in the log,
 * keyed by correlation id. A failure after the response was committed cannot be rewritten
 * and is propagated unchanged.
 */
@Component
public class GatewayErrorResponder {

    private static final Logger log = LoggerFactory.getLogger(GatewayErrorResponder.class);

    private final ObjectMapper objectMapper;

    public GatewayErrorResponder() {
        this.objectMapper = new ObjectMapper();
    }

    public Mono<Void> write(ServerWebExchange exchange, Throwable error, String correlationId, String routeId) {
        ErrorResponse errorResponse = classify(error);
        logFailure(error, errorResponse, correlationId, routeId);

        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.error(error);
        }

        response.setStatusCode(errorResponse.status());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] body = errorBody(errorResponse);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }

    /**
     * Status, error code and public message for a failure.
     */
    public ErrorResponse classify(Throwable error) {
        if (error instanceof GatewayException) {
            GatewayException gatewayException = (GatewayException) error;
            return new ErrorResponse(gatewayException.getStatus(),
                gatewayException.getErrorCode(), gatewayException.getPublicMessage());
        }
        if (error instanceof CallNotPermittedException) {
            return new ErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE",
                "Service temporarily unavailable");
        }
        if (error instanceof TimeoutException) {
            return new ErrorResponse(HttpStatus.GATEWAY_TIMEOUT, "GATEWAY_TIMEOUT", "Upstream timed out");
        }
        if (error instanceof ResponseStatusException) {
            HttpStatusCode statusCode = ((ResponseStatusException) error).getStatusCode();
            HttpStatus status = HttpStatus.resolve(statusCode.value());
            if (status == null) {
                status = HttpStatus.BAD_GATEWAY;
            }
            return new ErrorResponse(status, status.name(), status.getReasonPhrase());
        }
        if (error instanceof ConnectException || error instanceof IOException) {
            return new ErrorResponse(HttpStatus.BAD_GATEWAY, "BAD_GATEWAY", "Upstream unavailable");
        }
        return new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error");
    }

    private void logFailure(Throwable error, ErrorResponse errorResponse, String correlationId, String routeId) {
        if (error instanceof AuthenticationException) {
            log.warn("Authentication failed: route={}, correlationId={}, reason={}, detail={}",
                routeId, correlationId, ((AuthenticationException) error).getReason(), error.getMessage());
        } else if (errorResponse.status().is5xxServerError() && !(error instanceof GatewayException)) {
            log.error("Request failed: route={}, correlationId={}, status={}",
                routeId, correlationId, errorResponse.status().value(), error);
        } else {
            log.warn("Request rejected: route={}, correlationId={}, status={}, detail={}",
                routeId, correlationId, errorResponse.status().value(), error.getMessage());
        }
    }

    private byte[] errorBody(ErrorResponse errorResponse) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", errorResponse.errorCode());
        body.put("message", errorResponse.message());
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error body", e);
            return ("{\"error\":\"" + errorResponse.errorCode() + "\"}").getBytes(StandardCharsets.UTF_8);
        }
    }

    public record ErrorResponse(HttpStatus status, String errorCode, String message) {
    }
}
