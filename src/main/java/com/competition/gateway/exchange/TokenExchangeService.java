package com.competition.gateway.exchange;

import com.competition.gateway.auth.InboundIdentity;
import com.competition.gateway.cache.ExchangeCache;
import com.competition.gateway.cache.ExchangeCacheKey;
import com.competition.gateway.resilience.ResiliencePolicies;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

/**
 * Obtains the token to present to a destination: from the exchange cache when fresh,
 * otherwise by a single-flight exchange with the identity provider under its resilience policy.
 */
@Service
public class TokenExchangeService {

    private final TokenExchangeClient tokenExchangeClient;
    private final ExchangeCache exchangeCache;
    private final ResiliencePolicies resiliencePolicies;

    public TokenExchangeService(TokenExchangeClient tokenExchangeClient,
                                ExchangeCache exchangeCache,
                                ResiliencePolicies resiliencePolicies) {
        this.tokenExchangeClient = tokenExchangeClient;
        this.exchangeCache = exchangeCache;
        this.resiliencePolicies = resiliencePolicies;
    }

    public Mono<ExchangedToken> obtain(InboundIdentity identity, String audience) {
        ExchangeCacheKey key = ExchangeCacheKey.of(identity.rawToken(), audience);
        return exchangeCache.getOrExchange(key, () -> resiliencePolicies.identityProvider()
            .apply(Mono.defer(() -> tokenExchangeClient.exchange(identity.rawToken(), audience)))
            .onErrorMap(TimeoutException.class, error -> new TokenExchangeException(
                TokenExchangeException.Kind.NETWORK_FAILURE,
                "Token exchange timed out for audience " + audience, error)));
    }
}
