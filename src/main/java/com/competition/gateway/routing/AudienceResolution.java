package com.competition.gateway.routing;

/**
 * Outcome of resolving a route: exchange for {@code audience}, or forward the original token.
 */
public record AudienceResolution(String routeId, String audience, boolean passThrough) {

    public static AudienceResolution exchangeFor(String routeId, String audience) {
        return new AudienceResolution(routeId, audience, false);
    }

    public static AudienceResolution passThrough(String routeId) {
        return new AudienceResolution(routeId, null, true);
    }
}
