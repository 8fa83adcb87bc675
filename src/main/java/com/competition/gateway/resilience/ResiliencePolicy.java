package com.competition.gateway.resilience;

import com.competition.gateway.config.GatewayConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Timeout, retry and circuit breaker around one call to one failure domain.
 *
 * <p>Each attempt is bounded by the attempt timeout and passes through the circuit breaker,
 * so timeouts count as failures. Retries (exponential backoff with jitter) apply only to
 * errors accepted by {@code retryable}. The total timeout bounds all attempts together.
 * An open breaker fails the call with {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException}
 * before the call is subscribed.
 */
public class ResiliencePolicy {

    private static final Logger log = LoggerFactory.getLogger(ResiliencePolicy.class);

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final Duration attemptTimeout;
    private final Duration totalTimeout;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double jitter;
    private final Predicate<Throwable> retryable;

    public ResiliencePolicy(String name,
                            CircuitBreaker circuitBreaker,
                            GatewayConfig.PolicyConfig config,
                            int maxRetries,
                            Predicate<Throwable> retryable) {
        this.name = name;
        this.circuitBreaker = circuitBreaker;
        this.attemptTimeout = config.getAttemptTimeout();
        this.totalTimeout = config.getTotalTimeout();
        this.maxRetries = maxRetries;
        this.initialBackoff = config.getInitialBackoff();
        this.maxBackoff = config.getMaxBackoff();
        this.jitter = config.getJitter();
        this.retryable = retryable;
    }

    public <T> Mono<T> apply(Mono<T> call) {
        Mono<T> attempt = call
            .timeout(attemptTimeout)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
        Mono<T> guarded = maxRetries > 0 ? attempt.retryWhen(retrySpec()) : attempt;
        return guarded.timeout(totalTimeout);
    }

    private RetryBackoffSpec retrySpec() {
        return Retry.backoff(maxRetries, initialBackoff)
            .maxBackoff(maxBackoff)
            .jitter(jitter)
            .filter(retryable)
            .doBeforeRetry(signal -> log.warn("Retrying call: policy={}, retry={}, cause={}",
                name, signal.totalRetries() + 1, signal.failure().getClass().getSimpleName()))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public String getName() {
        return name;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
