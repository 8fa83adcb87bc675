package com.competition.gateway.forward;

import org.springframework.http.server.reactive.ServerHttpRequest;

import java.util.UUID;

/**
 * Correlation id of one logical request. An inbound value is kept verbatim;
 * a missing or blank one is replaced by a random UUID.
 */
public record CorrelationContext(String correlationId, boolean generated) {

    public static CorrelationContext from(ServerHttpRequest request) {
        String inbound = request.getHeaders().getFirst(GatewayHeaders.CORRELATION_ID);
        if (inbound == null || inbound.isBlank()) {
            return new CorrelationContext(UUID.randomUUID().toString(), true);
        }
        return new CorrelationContext(inbound, false);
    }
}
