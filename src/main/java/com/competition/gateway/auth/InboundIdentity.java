package com.competition.gateway.auth;

import java.time.Instant;
import java.util.Set;

/**
 * Identity derived from a validated inbound token. Lives for one request.
 *
 * <p>{@code rawToken} is the exchange subject token and a cache-key input;
 * it is deliberately left out of {@link #toString()}.
 */
public record InboundIdentity(
    String subject,
    String tenantId,
    Set<String> roles,
    Instant expiresAt,
    String tokenId,
    String rawToken
) {

    public InboundIdentity {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    @Override
    public String toString() {
        return "InboundIdentity[subject=" + subject + ", tenantId=" + tenantId
            + ", roles=" + roles + ", expiresAt=" + expiresAt + "]";
    }
}
