package com.competition.gateway.routing;

/**
 * What to do with a route that has no configured target audience.
 */
public enum UnmappedRoutePolicy {
    /** Reject the request (fail closed). */
    REJECT,
    /** Forward the caller's original token unmodified. */
    PASS_THROUGH
}
