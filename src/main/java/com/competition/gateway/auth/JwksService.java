package com.competition.gateway.auth;

import com.competition.gateway.config.GatewayConfig;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * JWKS Service
 *
 * <p>Fetches and caches the identity provider's JSON Web Key Set.
 * Keys are refreshed periodically to follow key rotation, and on demand when a token
 * names an unknown key id (at most once per {@code jwks-min-refresh-interval}, so forged
 * key ids cannot drive a fetch per request).
 */
@Service
public class JwksService {

    private static final Logger log = LoggerFactory.getLogger(JwksService.class);

    private final WebClient webClient;
    private final String jwksUri;
    private final Duration minRefreshInterval;
    private final Clock clock;

    // Replaced as a whole on refresh
    private volatile Map<String, RSAKey> jwkCache = Map.of();
    private volatile Instant lastFetchTime = Instant.EPOCH;
    private final AtomicReference<Mono<Void>> inFlightRefresh = new AtomicReference<>();

    public JwksService(WebClient identityProviderWebClient, GatewayConfig gatewayConfig, Clock clock) {
        this.webClient = identityProviderWebClient;
        this.jwksUri = gatewayConfig.getJwt().getJwksUri();
        this.minRefreshInterval = gatewayConfig.getJwt().getJwksMinRefreshInterval();
        this.clock = clock;
    }

    /**
     * Get public key by Key ID (kid)
     *
     * @param kid Key ID from JWT header
     * @return Mono<RSAKey> with the public key, or an {@link AuthenticationException} when unknown
     */
    public Mono<RSAKey> getPublicKey(String kid) {
        RSAKey key = jwkCache.get(kid);
        if (key != null) {
            return Mono.just(key);
        }

        if (clock.instant().isBefore(lastFetchTime.plus(minRefreshInterval))) {
            return Mono.error(unknownKey(kid));
        }

        // Cache miss - refresh and try again
        log.warn("JWK key not found in cache: kid={}, refreshing cache...", kid);
        return refreshJwksCache()
            .then(Mono.fromCallable(() -> {
                RSAKey refreshedKey = jwkCache.get(kid);
                if (refreshedKey == null) {
                    throw unknownKey(kid);
                }
                return refreshedKey;
            }));
    }

    /**
     * Refresh JWKS cache from the identity provider. Never fails: on error the
     * previous keys stay in place. Callers arriving while a fetch is running share it.
     */
    @Scheduled(
        fixedDelayString = "${gateway.jwt.jwks-cache-refresh-interval-ms:300000}",
        initialDelayString = "${gateway.jwt.jwks-cache-refresh-interval-ms:300000}")
    public Mono<Void> refreshJwksCache() {
        return Mono.defer(() -> {
            Mono<Void> existing = inFlightRefresh.get();
            if (existing != null) {
                return existing;
            }
            AtomicReference<Mono<Void>> self = new AtomicReference<>();
            Mono<Void> refresh = fetchSigningKeys()
                .doFinally(signal -> inFlightRefresh.compareAndSet(self.get(), null))
                .share();
            self.set(refresh);
            if (inFlightRefresh.compareAndSet(null, refresh)) {
                return refresh;
            }
            Mono<Void> winner = inFlightRefresh.get();
            return winner != null ? winner : refresh;
        });
    }

    private Mono<Void> fetchSigningKeys() {
        log.debug("Refreshing JWKS cache from identity provider...");

        return webClient.get()
            .uri(jwksUri)
            .retrieve()
            .bodyToMono(String.class)
            .doOnSubscribe(subscription -> lastFetchTime = clock.instant())
            .doOnNext(response -> {
                try {
                    jwkCache = parseSigningKeys(response);
                    log.info("JWKS cache refreshed: {} keys cached", jwkCache.size());
                } catch (ParseException e) {
                    log.error("Failed to parse JWKS response from identity provider", e);
                }
            })
            .doOnError(error -> log.error("Failed to fetch JWKS from identity provider: {}", error.getMessage()))
            // Don't clear cache on error - use stale keys
            .onErrorResume(error -> Mono.empty())
            .then();
    }

    /**
     * Initialize cache on startup
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeCache() {
        log.info("Initializing JWKS cache...");
        refreshJwksCache().block(Duration.ofSeconds(10));
    }

    private Map<String, RSAKey> parseSigningKeys(String jwksJson) throws ParseException {
        JWKSet jwkSet = JWKSet.parse(jwksJson);
        Map<String, RSAKey> keys = new HashMap<>();
        for (JWK jwk : jwkSet.getKeys()) {
            if (jwk instanceof RSAKey && jwk.getKeyID() != null
                    && (jwk.getKeyUse() == null || KeyUse.SIGNATURE.equals(jwk.getKeyUse()))) {
                RSAKey rsaKey = (RSAKey) jwk;
                keys.put(rsaKey.getKeyID(), rsaKey);
                log.debug("Cached JWK: kid={}", rsaKey.getKeyID());
            }
        }
        return Map.copyOf(keys);
    }

    private static AuthenticationException unknownKey(String kid) {
        return new AuthenticationException(AuthenticationException.Reason.UNKNOWN_KEY,
            "JWK key not found: kid=" + kid);
    }
}
