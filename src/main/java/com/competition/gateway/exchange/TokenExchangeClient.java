package com.competition.gateway.exchange;

import reactor.core.publisher.Mono;

/**
 * OAuth 2.0 Token Exchange (RFC 8693) against the identity provider.
 */
public interface TokenExchangeClient {

    /**
     * Exchange the caller's token for one scoped to {@code audience}.
     *
     * @param subjectToken the validated inbound token
     * @param audience target service audience, e.g. "competition-service"
     * @return the exchanged token, or a {@link TokenExchangeException} signal
     */
    Mono<ExchangedToken> exchange(String subjectToken, String audience);
}
