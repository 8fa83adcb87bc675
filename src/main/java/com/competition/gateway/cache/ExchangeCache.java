package com.competition.gateway.cache;

import com.competition.gateway.exchange.ExchangedToken;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Store of exchanged tokens keyed by (subject token hash, audience).
 *
 * <p>Implementations must be safe for concurrent use and must never return a token
 * whose expiry falls within the configured refresh buffer.
 */
public interface ExchangeCache {

    /**
     * @return the cached token if present and still outside the refresh buffer
     */
    Optional<ExchangedToken> get(ExchangeCacheKey key);

    /**
     * Store (or replace) the token for {@code key}.
     *
     * @throws IllegalArgumentException if the token was issued for another audience than the key's
     */
    void put(ExchangeCacheKey key, ExchangedToken token);

    /**
     * Serve from cache, or run {@code exchange} on a miss. Concurrent misses on the same key
     * share one in-flight exchange; every waiter receives its result or its error.
     * Failed exchanges are not cached.
     */
    Mono<ExchangedToken> getOrExchange(ExchangeCacheKey key, Supplier<Mono<ExchangedToken>> exchange);

    /**
     * Drop every cached token obtained with the given subject token, whatever the audience.
     *
     * @return number of entries removed
     */
    int invalidateSubject(String subjectHash);

    /**
     * Remove entries that can no longer be served.
     *
     * @return number of entries removed
     */
    int evictExpired();

    int size();
}
