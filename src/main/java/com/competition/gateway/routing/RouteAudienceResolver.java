package com.competition.gateway.routing;

import com.competition.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.cloud.gateway.route.Route;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Route-Audience Resolver
 *
 * <p>Maps a gateway route id to the audience the exchanged token must carry.
 * The mapping is loaded once from {@code gateway.routing.audiences} and never changes,
 * so lookups need no synchronization and do no I/O.
 */
@Component
public class RouteAudienceResolver {

    private static final Logger log = LoggerFactory.getLogger(RouteAudienceResolver.class);

    private final Map<String, String> audiences;
    private final UnmappedRoutePolicy unmappedRoutePolicy;
    private final HttpStatus unmappedRouteStatus;

    public RouteAudienceResolver(GatewayConfig gatewayConfig) {
        GatewayConfig.RoutingConfig routing = gatewayConfig.getRouting();
        this.audiences = Map.copyOf(routing.getAudiences());
        this.unmappedRoutePolicy = routing.getUnmappedRoutePolicy();
        this.unmappedRouteStatus = HttpStatus.valueOf(routing.getUnmappedRouteStatus());
        log.info("Route audiences loaded: routes={}, unmappedRoutePolicy={}", audiences.keySet(), unmappedRoutePolicy);
    }

    /**
     * @param routeId gateway route id
     * @return the target audience, or pass-through when so configured
     * @throws NoMappingException if the route is unmapped and the policy is {@link UnmappedRoutePolicy#REJECT}
     */
    public AudienceResolution resolve(String routeId) {
        String audience = routeId != null ? audiences.get(routeId) : null;
        if (audience != null) {
            return AudienceResolution.exchangeFor(routeId, audience);
        }
        if (unmappedRoutePolicy == UnmappedRoutePolicy.PASS_THROUGH) {
            return AudienceResolution.passThrough(routeId);
        }
        throw new NoMappingException(routeId, unmappedRouteStatus);
    }

    /**
     * Report routes without a mapping, and mappings without a route.
     *
     * @return the ids of configured routes that have no audience mapping
     */
    public List<String> checkCoverage(Collection<String> routeIds) {
        List<String> unmapped = routeIds.stream()
            .filter(routeId -> !audiences.containsKey(routeId))
            .sorted()
            .collect(Collectors.toList());
        if (!unmapped.isEmpty()) {
            log.warn("Routes without audience mapping: routes={}, policy={}", unmapped, unmappedRoutePolicy);
        }
        audiences.keySet().stream()
            .filter(routeId -> !routeIds.contains(routeId))
            .sorted()
            .forEach(routeId -> log.warn("Audience mapping for unknown route: route={}", routeId));
        return unmapped;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkConfiguredRoutes(ApplicationReadyEvent event) {
        RouteLocator routeLocator = event.getApplicationContext().getBeanProvider(RouteLocator.class).getIfAvailable();
        if (routeLocator == null) {
            return;
        }
        List<String> routeIds = routeLocator.getRoutes()
            .map(Route::getId)
            .collectList()
            .block(Duration.ofSeconds(10));
        if (routeIds != null) {
            checkCoverage(routeIds);
        }
    }
}
