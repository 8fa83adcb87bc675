package com.competition.gateway.cache;

import com.competition.gateway.exchange.ExchangedToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * In-memory, per-process exchange cache.
 *
 * <p>Entries are evicted lazily on lookup once {@code now >= expiresAt - refreshBuffer},
 * and by a periodic sweep so that abandoned (identity, audience) pairs do not accumulate.
 *
 * <p>Single-flight: the first miss for a key registers a shared exchange in {@code inFlight};
 * concurrent misses subscribe to the same one. The shared exchange is not cancelled when
 * one waiter goes away, so the other waiters still get their result.
 */
public class InMemoryExchangeCache implements ExchangeCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExchangeCache.class);

    private final Map<ExchangeCacheKey, ExchangedToken> entries = new ConcurrentHashMap<>();
    private final Map<ExchangeCacheKey, Mono<ExchangedToken>> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration refreshBuffer;

    public InMemoryExchangeCache(Clock clock, Duration refreshBuffer) {
        this.clock = clock;
        this.refreshBuffer = refreshBuffer;
    }

    @Override
    public Optional<ExchangedToken> get(ExchangeCacheKey key) {
        ExchangedToken token = entries.get(key);
        if (token == null) {
            return Optional.empty();
        }
        if (token.isServable(clock.instant(), refreshBuffer)) {
            return Optional.of(token);
        }
        entries.remove(key, token);
        log.debug("Exchanged token within refresh buffer, evicted: audience={}, expiresAt={}",
            key.audience(), token.expiresAt());
        return Optional.empty();
    }

    @Override
    public void put(ExchangeCacheKey key, ExchangedToken token) {
        if (!key.audience().equals(token.audience())) {
            throw new IllegalArgumentException(
                "Token for audience " + token.audience() + " cannot be cached under audience " + key.audience());
        }
        entries.put(key, token);
    }

    @Override
    public Mono<ExchangedToken> getOrExchange(ExchangeCacheKey key, Supplier<Mono<ExchangedToken>> exchange) {
        return Mono.defer(() -> {
            Optional<ExchangedToken> cached = get(key);
            if (cached.isPresent()) {
                log.debug("Exchange cache hit: audience={}", key.audience());
                return Mono.just(cached.get());
            }
            return inFlight.computeIfAbsent(key, k -> newFlight(k, exchange));
        });
    }

    private Mono<ExchangedToken> newFlight(ExchangeCacheKey key, Supplier<Mono<ExchangedToken>> exchange) {
        log.debug("Exchange cache miss: audience={}", key.audience());
        AtomicReference<Mono<ExchangedToken>> self = new AtomicReference<>();
        Mono<ExchangedToken> flight = Mono.defer(exchange)
            .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                "Token exchange completed without a token for audience " + key.audience())))
            .doOnNext(token -> store(key, token))
            .doFinally(signal -> inFlight.remove(key, self.get()))
            .share();
        self.set(flight);
        return flight;
    }

    /**
     * A token issued with a lifetime at or under the refresh buffer still goes to the waiting
     * requests, but caching it is pointless: every later lookup would treat it as absent.
     */
    private void store(ExchangeCacheKey key, ExchangedToken token) {
        if (!token.isServable(clock.instant(), refreshBuffer)) {
            log.warn("Exchanged token lifetime within refresh buffer, not cached: audience={}, expiresAt={}, refreshBuffer={}",
                key.audience(), token.expiresAt(), refreshBuffer);
            return;
        }
        put(key, token);
    }

    @Override
    public int invalidateSubject(String subjectHash) {
        int removed = 0;
        for (Map.Entry<ExchangeCacheKey, ExchangedToken> entry : entries.entrySet()) {
            if (entry.getKey().subjectHash().equals(subjectHash)
                    && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<ExchangeCacheKey, ExchangedToken> entry : entries.entrySet()) {
            if (!entry.getValue().isServable(now, refreshBuffer)
                    && entries.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Periodic sweep for memory hygiene; lazy eviction alone keeps lookups correct.
     */
    @Scheduled(fixedDelayString = "${gateway.exchange.cache-sweep-interval-ms:60000}")
    public void sweep() {
        int evicted = evictExpired();
        if (evicted > 0) {
            log.debug("Exchange cache sweep: evicted={}, remaining={}", evicted, entries.size());
        }
    }

    @Override
    public int size() {
        return entries.size();
    }
}
