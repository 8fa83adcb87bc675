package com.competition.gateway.filter;

import com.competition.gateway.auth.BearerTokens;
import com.competition.gateway.auth.InboundAuthenticator;
import com.competition.gateway.auth.InboundIdentity;
import com.competition.gateway.auth.TokenRevocationService;
import com.competition.gateway.config.GatewayConfig;
import com.competition.gateway.error.GatewayErrorResponder;
import com.competition.gateway.exchange.ExchangedToken;
import com.competition.gateway.exchange.TokenExchangeService;
import com.competition.gateway.forward.CorrelationContext;
import com.competition.gateway.forward.ForwardingPipeline;
import com.competition.gateway.routing.AudienceResolution;
import com.competition.gateway.routing.RouteAudienceResolver;
import com.competition.gateway.util.PublicPathMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.cloud.gateway.route.Route;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Token Exchange Filter
 *
 * <p>Global filter running the whole edge pipeline for every routed request, as one
 * explicit sequence of stages:
 * <ol>
 *   <li>resolve the correlation id (kept or generated)</li>
 *   <li>public paths: forward without authentication or exchange</li>
 *   <li>authenticate the bearer token</li>
 *   <li>check the revocation list</li>
 *   <li>resolve the route's target audience</li>
 *   <li>obtain the exchanged token (cache hit, or single-flight exchange)</li>
 *   <li>forward with the exchanged token, tenant and correlation headers</li>
 * </ol>
 * Any failure ends the request with a gateway error response; nothing is forwarded.
 */
@Component
public class TokenExchangeFilter implements GlobalFilter, Ordered {

    private static final Logger log = LoggerFactory.getLogger(TokenExchangeFilter.class);

    public static final String CORRELATION_ID_ATTR = TokenExchangeFilter.class.getName() + ".correlationId";

    private final InboundAuthenticator inboundAuthenticator;
    private final TokenRevocationService tokenRevocationService;
    private final RouteAudienceResolver routeAudienceResolver;
    private final TokenExchangeService tokenExchangeService;
    private final ForwardingPipeline forwardingPipeline;
    private final GatewayErrorResponder errorResponder;
    private final PublicPathMatcher publicPathMatcher;

    public TokenExchangeFilter(
            InboundAuthenticator inboundAuthenticator,
            TokenRevocationService tokenRevocationService,
            RouteAudienceResolver routeAudienceResolver,
            TokenExchangeService tokenExchangeService,
            ForwardingPipeline forwardingPipeline,
            GatewayErrorResponder errorResponder,
            GatewayConfig gatewayConfig) {
        this.inboundAuthenticator = inboundAuthenticator;
        this.tokenRevocationService = tokenRevocationService;
        this.routeAudienceResolver = routeAudienceResolver;
        this.tokenExchangeService = tokenExchangeService;
        this.forwardingPipeline = forwardingPipeline;
        this.errorResponder = errorResponder;
        this.publicPathMatcher = new PublicPathMatcher(gatewayConfig.getPublicPaths());
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getURI().getPath();
        String routeId = routeId(exchange);

        // 1. Correlation id, echoed on every response including errors
        String correlationId = CorrelationContext.from(request).correlationId();
        exchange.getAttributes().put(CORRELATION_ID_ATTR, correlationId);
        forwardingPipeline.prepareResponse(exchange, correlationId);

        // 2. Public paths skip authentication and exchange
        if (publicPathMatcher.isPublicPath(path)) {
            log.debug("Public path, skipping authentication: path={}, correlationId={}", path, correlationId);
            return forwardingPipeline.forwardPublic(exchange, chain, routeId, correlationId)
                .onErrorResume(error -> errorResponder.write(exchange, error, correlationId, routeId));
        }

        String bearerToken = BearerTokens.extract(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
            .orElse(null);

        // 3. Authenticate, 4. revocation
        return inboundAuthenticator.authenticate(bearerToken)
            .flatMap(identity -> tokenRevocationService.ensureNotRevoked(identity).thenReturn(identity))
            // 5. Resolve audience, 6. exchange, 7. forward
            .flatMap(identity -> outboundToken(identity, routeId)
                .flatMap(token -> forwardingPipeline.forward(
                    exchange, chain, routeId, identity, token, correlationId)))
            .onErrorResume(error -> errorResponder.write(exchange, error, correlationId, routeId));
    }

    private Mono<String> outboundToken(InboundIdentity identity, String routeId) {
        return Mono.fromCallable(() -> routeAudienceResolver.resolve(routeId))
            .flatMap(resolution -> tokenFor(identity, resolution));
    }

    private Mono<String> tokenFor(InboundIdentity identity, AudienceResolution resolution) {
        if (resolution.passThrough()) {
            log.debug("Pass-through route, forwarding original token: route={}", resolution.routeId());
            return Mono.just(identity.rawToken());
        }
        return tokenExchangeService.obtain(identity, resolution.audience())
            .map(ExchangedToken::value);
    }

    private static String routeId(ServerWebExchange exchange) {
        Route route = exchange.getAttribute(ServerWebExchangeUtils.GATEWAY_ROUTE_ATTR);
        return route != null ? route.getId() : null;
    }

    @Override
    public int getOrder() {
        // High precedence - run before other filters
        return -100;
    }
}
