package com.competition.gateway.exchange;

import java.time.Duration;
import java.time.Instant;

/**
 * A token issued by the identity provider for one target audience.
 * Immutable: a refresh produces a new instance.
 */
public record ExchangedToken(String audience, String value, Instant expiresAt, Instant fetchedAt) {

    /**
     * @return true while {@code now} is before {@code expiresAt - refreshBuffer}
     */
    public boolean isServable(Instant now, Duration refreshBuffer) {
        return now.isBefore(expiresAt.minus(refreshBuffer));
    }

    @Override
    public String toString() {
        return "ExchangedToken[audience=" + audience + ", expiresAt=" + expiresAt
            + ", fetchedAt=" + fetchedAt + "]";
    }
}
