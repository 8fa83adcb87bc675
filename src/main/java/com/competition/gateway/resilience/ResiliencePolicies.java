package com.competition.gateway.resilience;

import com.competition.gateway.config.GatewayConfig;
import com.competition.gateway.exchange.TokenExchangeException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Resilience policies per failure domain: one for the identity provider,
 * one per destination route. Proxied calls are never retried.
 */
public class ResiliencePolicies {

    private static final Logger log = LoggerFactory.getLogger(ResiliencePolicies.class);

    static final String IDENTITY_PROVIDER = "identity-provider";
    static final String DESTINATION_PREFIX = "destination-";

    private final CircuitBreakerRegistry registry;
    private final GatewayConfig.PolicyConfig destinationConfig;
    private final CircuitBreakerConfig destinationBreakerConfig;
    private final ResiliencePolicy identityProviderPolicy;
    private final Map<String, ResiliencePolicy> destinationPolicies = new ConcurrentHashMap<>();

    public ResiliencePolicies(CircuitBreakerRegistry registry,
                              GatewayConfig.PolicyConfig identityProviderConfig,
                              GatewayConfig.PolicyConfig destinationConfig) {
        this.registry = registry;
        this.destinationConfig = destinationConfig;
        this.destinationBreakerConfig = breakerConfig(destinationConfig).build();

        CircuitBreakerConfig identityProviderBreakerConfig = breakerConfig(identityProviderConfig)
            .ignoreException(ResiliencePolicies::isRejection)
            .build();
        this.identityProviderPolicy = new ResiliencePolicy(
            IDENTITY_PROVIDER,
            breaker(IDENTITY_PROVIDER, identityProviderBreakerConfig),
            identityProviderConfig,
            identityProviderConfig.getMaxRetries(),
            ResiliencePolicies::isRetryableExchangeFailure);
    }

    public ResiliencePolicy identityProvider() {
        return identityProviderPolicy;
    }

    public ResiliencePolicy destination(String routeId) {
        return destinationPolicies.computeIfAbsent(routeId, id -> new ResiliencePolicy(
            DESTINATION_PREFIX + id,
            breaker(DESTINATION_PREFIX + id, destinationBreakerConfig),
            destinationConfig,
            0,
            error -> false));
    }

    private CircuitBreaker breaker(String name, CircuitBreakerConfig config) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(name, config);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
            log.warn("Circuit breaker state change: name={}, transition={}",
                name, event.getStateTransition()));
        return circuitBreaker;
    }

    private static CircuitBreakerConfig.Builder breakerConfig(GatewayConfig.PolicyConfig config) {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
            .slidingWindowSize(config.getSlidingWindowSeconds())
            .minimumNumberOfCalls(config.getMinimumNumberOfCalls())
            .failureRateThreshold(config.getFailureRateThreshold())
            .waitDurationInOpenState(config.getWaitDurationInOpenState());
    }

    static boolean isRetryableExchangeFailure(Throwable error) {
        if (error instanceof TimeoutException) {
            return true;
        }
        return error instanceof TokenExchangeException && ((TokenExchangeException) error).isRetryable();
    }

    /**
     * A rejected subject token says nothing about the identity provider's health.
     */
    static boolean isRejection(Throwable error) {
        return error instanceof TokenExchangeException
            && ((TokenExchangeException) error).getKind() == TokenExchangeException.Kind.IDENTITY_PROVIDER_REJECTED;
    }
}
