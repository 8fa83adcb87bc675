package com.competition.gateway.exchange;

import com.competition.gateway.config.GatewayConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jwt.JWTParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Identity Provider Token Exchange Client
 *
 * <p>Performs RFC 8693 token exchange against the identity provider's token endpoint,
 * authenticating the gateway with {@code client_secret_post}.
 *
 * <p>Only metadata is logged (audience, outcome, latency). Neither the subject token,
 * the issued token nor the identity provider's error body is ever written to the log.
 */
@Component
public class IdentityProviderTokenExchangeClient implements TokenExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(IdentityProviderTokenExchangeClient.class);

    static final String GRANT_TYPE_TOKEN_EXCHANGE = "urn:ietf:params:oauth:grant-type:token-exchange";
    static final String TOKEN_TYPE_ACCESS_TOKEN = "urn:ietf:params:oauth:token-type:access_token";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String tokenEndpoint;
    private final String clientId;
    private final String clientSecret;

    public IdentityProviderTokenExchangeClient(WebClient identityProviderWebClient,
                                               GatewayConfig gatewayConfig,
                                               Clock clock) {
        this.webClient = identityProviderWebClient;
        this.objectMapper = new ObjectMapper();
        this.clock = clock;
        this.tokenEndpoint = gatewayConfig.getExchange().getTokenEndpoint();
        this.clientId = gatewayConfig.getExchange().getClientId();
        this.clientSecret = gatewayConfig.getExchange().getClientSecret();
    }

    @Override
    public Mono<ExchangedToken> exchange(String subjectToken, String audience) {
        if (subjectToken == null || subjectToken.isBlank()) {
            return Mono.error(new IllegalArgumentException("Subject token is required"));
        }
        if (audience == null || audience.isBlank()) {
            return Mono.error(new IllegalArgumentException("Target audience is required"));
        }

        return Mono.defer(() -> {
            long started = System.nanoTime();
            return webClient.post()
                .uri(tokenEndpoint)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(exchangeForm(subjectToken, audience)))
                .exchangeToMono(response -> handleResponse(response, audience))
                .onErrorMap(error -> !(error instanceof TokenExchangeException),
                    error -> new TokenExchangeException(TokenExchangeException.Kind.NETWORK_FAILURE,
                        "Token exchange request failed for audience " + audience + ": "
                            + error.getClass().getSimpleName(), error))
                .doOnSuccess(token -> log.info(
                    "Token exchange succeeded: audience={}, expiresAt={}, latencyMs={}",
                    audience, token.expiresAt(), elapsedMillis(started)))
                .doOnError(TokenExchangeException.class, error -> log.warn(
                    "Token exchange failed: audience={}, outcome={}, latencyMs={}",
                    audience, error.getKind(), elapsedMillis(started)));
        });
    }

    private MultiValueMap<String, String> exchangeForm(String subjectToken, String audience) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", GRANT_TYPE_TOKEN_EXCHANGE);
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        form.add("subject_token", subjectToken);
        form.add("subject_token_type", TOKEN_TYPE_ACCESS_TOKEN);
        form.add("requested_token_type", TOKEN_TYPE_ACCESS_TOKEN);
        form.add("audience", audience);
        return form;
    }

    private Mono<ExchangedToken> handleResponse(ClientResponse response, String audience) {
        HttpStatusCode status = response.statusCode();
        if (status.is5xxServerError()) {
            return response.releaseBody().then(Mono.error(new TokenExchangeException(
                TokenExchangeException.Kind.IDENTITY_PROVIDER_UNAVAILABLE,
                "Identity provider unavailable for audience " + audience + ": status=" + status.value())));
        }
        if (!status.is2xxSuccessful()) {
            // Subject token refused: retrying cannot help
            return response.releaseBody().then(Mono.error(new TokenExchangeException(
                TokenExchangeException.Kind.IDENTITY_PROVIDER_REJECTED,
                "Identity provider rejected token exchange for audience " + audience + ": status=" + status.value())));
        }
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(body -> Mono.fromCallable(() -> parseResponse(body, audience)));
    }

    private ExchangedToken parseResponse(String body, String audience) {
        TokenExchangeResponse response;
        try {
            response = objectMapper.readValue(body, TokenExchangeResponse.class);
        } catch (JsonProcessingException e) {
            throw new TokenExchangeException(TokenExchangeException.Kind.MALFORMED_RESPONSE,
                "Token exchange response is not valid JSON for audience " + audience, e);
        }
        if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
            throw new TokenExchangeException(TokenExchangeException.Kind.MALFORMED_RESPONSE,
                "Token exchange response missing access_token for audience " + audience);
        }

        Instant now = clock.instant();
        return new ExchangedToken(audience, response.accessToken(), resolveExpiry(response, now, audience), now);
    }

    /**
     * {@code expires_in} is only RECOMMENDED by RFC 8693; fall back to the issued JWT's {@code exp}.
     */
    private Instant resolveExpiry(TokenExchangeResponse response, Instant now, String audience) {
        if (response.expiresIn() != null && response.expiresIn() > 0) {
            return now.plusSeconds(response.expiresIn());
        }
        try {
            Date expirationTime = JWTParser.parse(response.accessToken()).getJWTClaimsSet().getExpirationTime();
            if (expirationTime != null) {
                return expirationTime.toInstant();
            }
        } catch (ParseException e) {
            throw new TokenExchangeException(TokenExchangeException.Kind.MALFORMED_RESPONSE,
                "Token exchange response has no lifetime for audience " + audience, e);
        }
        throw new TokenExchangeException(TokenExchangeException.Kind.MALFORMED_RESPONSE,
            "Token exchange response has no lifetime for audience " + audience);
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
