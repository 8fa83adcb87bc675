package com.competition.gateway.auth;

import com.competition.gateway.cache.ExchangeCache;
import com.competition.gateway.cache.ExchangeCacheKey;
import com.competition.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Token Revocation Service (Reactive)
 *
 * <p>Checks the revocation list in Redis for tokens revoked before their expiry
 * (logout, account lock). A revoked token also loses every exchanged token cached for it.
 * Disabled unless {@code gateway.revocation.enabled} is set.
 */
@Service
public class TokenRevocationService {

    private static final Logger log = LoggerFactory.getLogger(TokenRevocationService.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ExchangeCache exchangeCache;
    private final boolean enabled;
    private final String keyPrefix;

    public TokenRevocationService(ReactiveStringRedisTemplate redisTemplate,
                                  ExchangeCache exchangeCache,
                                  GatewayConfig gatewayConfig) {
        this.redisTemplate = redisTemplate;
        this.exchangeCache = exchangeCache;
        this.enabled = gatewayConfig.getRevocation().isEnabled();
        this.keyPrefix = gatewayConfig.getRevocation().getKeyPrefix();
    }

    /**
     * Complete empty if the token is not revoked.
     *
     * @return an {@link AuthenticationException} signal for a revoked token, or a
     *         {@link RevocationCheckException} if Redis cannot be reached (fail closed)
     */
    public Mono<Void> ensureNotRevoked(InboundIdentity identity) {
        String tokenId = identity.tokenId();
        if (!enabled || tokenId == null || tokenId.isBlank()) {
            return Mono.empty();
        }

        return redisTemplate.hasKey(keyPrefix + tokenId)
            .onErrorMap(error -> new RevocationCheckException(
                "Error checking token revocation: tokenId=" + tokenId, error))
            .flatMap(revoked -> {
                if (!Boolean.TRUE.equals(revoked)) {
                    return Mono.<Void>empty();
                }
                int evicted = exchangeCache.invalidateSubject(ExchangeCacheKey.hashSubject(identity.rawToken()));
                log.debug("Token revoked: tokenId={}, evictedExchangedTokens={}", tokenId, evicted);
                return Mono.<Void>error(new AuthenticationException(
                    AuthenticationException.Reason.REVOKED, "Token has been revoked: tokenId=" + tokenId));
            });
    }
}
