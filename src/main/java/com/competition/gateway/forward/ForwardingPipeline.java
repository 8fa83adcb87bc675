package com.competition.gateway.forward;

import com.competition.gateway.auth.InboundIdentity;
import com.competition.gateway.config.GatewayConfig;
import com.competition.gateway.resilience.ResiliencePolicies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Forwarding Pipeline
 *
 * <p>Rewrites the outbound request and hands it to the rest of the gateway filter chain
 * (which performs the proxied call) under the destination's resilience policy.
 * Tenant and user headers come only from the validated identity; any client-supplied
 * values are dropped. The proxied call is never retried.
 */
@Component
public class ForwardingPipeline {

    private static final Logger log = LoggerFactory.getLogger(ForwardingPipeline.class);

    private static final String UNROUTED = "unrouted";

    private final ResiliencePolicies resiliencePolicies;
    private final List<String> strippedResponseHeaders;

    public ForwardingPipeline(ResiliencePolicies resiliencePolicies, GatewayConfig gatewayConfig) {
        this.resiliencePolicies = resiliencePolicies;
        this.strippedResponseHeaders = List.copyOf(gatewayConfig.getForwarding().getStrippedResponseHeaders());
    }

    /**
     * Register the response rewrite: the caller's correlation id replaces any value the destination
     * set, and sensitive headers are removed. Applies to proxied responses and to gateway error
     * responses alike.
     */
    public void prepareResponse(ServerWebExchange exchange, String correlationId) {
        ServerHttpResponse response = exchange.getResponse();
        response.beforeCommit(() -> {
            HttpHeaders headers = response.getHeaders();
            strippedResponseHeaders.forEach(headers::remove);
            headers.set(GatewayHeaders.CORRELATION_ID, correlationId);
            return Mono.empty();
        });
    }

    /**
     * Forward an authenticated request with {@code bearerToken} as its only credential.
     *
     * @param bearerToken exchanged token, or the original token on a pass-through route
     */
    public Mono<Void> forward(ServerWebExchange exchange, GatewayFilterChain chain, String routeId,
                              InboundIdentity identity, String bearerToken, String correlationId) {
        ServerHttpRequest outbound = exchange.getRequest().mutate()
            .headers(headers -> {
                headers.remove(HttpHeaders.AUTHORIZATION);
                headers.setBearerAuth(bearerToken);
                headers.set(GatewayHeaders.TENANT_ID, identity.tenantId());
                headers.set(GatewayHeaders.USER_ID, identity.subject());
                headers.set(GatewayHeaders.CORRELATION_ID, correlationId);
            })
            .build();

        log.debug("Forwarding request: route={}, tenantId={}, correlationId={}",
            routeId, identity.tenantId(), correlationId);
        return proxy(exchange.mutate().request(outbound).build(), chain, routeId);
    }

    /**
     * Forward a request on a public path. Any caller credential is dropped along with the identity
     * headers: a gateway-audience token never reaches a destination.
     */
    public Mono<Void> forwardPublic(ServerWebExchange exchange, GatewayFilterChain chain, String routeId,
                                    String correlationId) {
        ServerHttpRequest outbound = exchange.getRequest().mutate()
            .headers(headers -> {
                headers.remove(HttpHeaders.AUTHORIZATION);
                headers.remove(GatewayHeaders.TENANT_ID);
                headers.remove(GatewayHeaders.USER_ID);
                headers.set(GatewayHeaders.CORRELATION_ID, correlationId);
            })
            .build();

        log.debug("Forwarding public request: route={}, correlationId={}", routeId, correlationId);
        return proxy(exchange.mutate().request(outbound).build(), chain, routeId);
    }

    private Mono<Void> proxy(ServerWebExchange exchange, GatewayFilterChain chain, String routeId) {
        String failureDomain = routeId != null ? routeId : UNROUTED;
        return resiliencePolicies.destination(failureDomain).apply(chain.filter(exchange));
    }
}
