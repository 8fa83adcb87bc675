package com.competition.gateway.config;

import com.competition.gateway.cache.ExchangeCache;
import com.competition.gateway.cache.InMemoryExchangeCache;
import com.competition.gateway.resilience.ResiliencePolicies;
import com.competition.gateway.routing.UnmappedRoutePolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway Configuration
 *
 * <p>Binds the {@code gateway.*} properties, validates them at startup and
 * wires the identity provider client, the exchange cache and the resilience policies.
 * A configuration error here is the only fatal failure of the gateway.
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    // Access token lifetimes are commonly 5 to 15 minutes
    static final Duration LARGE_REFRESH_BUFFER = Duration.ofMinutes(5);

    private JwtConfig jwt = new JwtConfig();
    private ExchangeConfig exchange = new ExchangeConfig();
    private RoutingConfig routing = new RoutingConfig();
    private ForwardingConfig forwarding = new ForwardingConfig();
    private ResilienceConfig resilience = new ResilienceConfig();
    private RevocationConfig revocation = new RevocationConfig();
    private List<String> publicPaths = new ArrayList<>();

    public static class JwtConfig {
        private String issuer;
        private String audience;
        private String jwksUri;
        private Duration clockSkew = Duration.ofMinutes(5);
        private long jwksCacheRefreshIntervalMs = 300000;
        private Duration jwksMinRefreshInterval = Duration.ofSeconds(10);
        private String tenantClaim = "tenant_id";
        private String rolesClaim = "roles";

        public String getIssuer() { return issuer; }
        public void setIssuer(String issuer) { this.issuer = issuer; }
        public String getAudience() { return audience; }
        public void setAudience(String audience) { this.audience = audience; }
        public String getJwksUri() { return jwksUri; }
        public void setJwksUri(String jwksUri) { this.jwksUri = jwksUri; }
        public Duration getClockSkew() { return clockSkew; }
        public void setClockSkew(Duration clockSkew) { this.clockSkew = clockSkew; }
        public long getJwksCacheRefreshIntervalMs() { return jwksCacheRefreshIntervalMs; }
        public void setJwksCacheRefreshIntervalMs(long jwksCacheRefreshIntervalMs) { this.jwksCacheRefreshIntervalMs = jwksCacheRefreshIntervalMs; }
        public Duration getJwksMinRefreshInterval() { return jwksMinRefreshInterval; }
        public void setJwksMinRefreshInterval(Duration jwksMinRefreshInterval) { this.jwksMinRefreshInterval = jwksMinRefreshInterval; }
        public String getTenantClaim() { return tenantClaim; }
        public void setTenantClaim(String tenantClaim) { this.tenantClaim = tenantClaim; }
        public String getRolesClaim() { return rolesClaim; }
        public void setRolesClaim(String rolesClaim) { this.rolesClaim = rolesClaim; }
    }

    public static class ExchangeConfig {
        private String tokenEndpoint;
        private String clientId;
        private String clientSecret;
        private Duration refreshBuffer = Duration.ofSeconds(300);
        private long cacheSweepIntervalMs = 60000;

        public String getTokenEndpoint() { return tokenEndpoint; }
        public void setTokenEndpoint(String tokenEndpoint) { this.tokenEndpoint = tokenEndpoint; }
        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }
        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
        public Duration getRefreshBuffer() { return refreshBuffer; }
        public void setRefreshBuffer(Duration refreshBuffer) { this.refreshBuffer = refreshBuffer; }
        public long getCacheSweepIntervalMs() { return cacheSweepIntervalMs; }
        public void setCacheSweepIntervalMs(long cacheSweepIntervalMs) { this.cacheSweepIntervalMs = cacheSweepIntervalMs; }
    }

    public static class RoutingConfig {
        private Map<String, String> audiences = new LinkedHashMap<>();
        private UnmappedRoutePolicy unmappedRoutePolicy = UnmappedRoutePolicy.REJECT;
        private int unmappedRouteStatus = 404;

        public Map<String, String> getAudiences() { return audiences; }
        public void setAudiences(Map<String, String> audiences) {
            this.audiences = audiences != null ? audiences : new LinkedHashMap<>();
        }
        public UnmappedRoutePolicy getUnmappedRoutePolicy() { return unmappedRoutePolicy; }
        public void setUnmappedRoutePolicy(UnmappedRoutePolicy unmappedRoutePolicy) { this.unmappedRoutePolicy = unmappedRoutePolicy; }
        public int getUnmappedRouteStatus() { return unmappedRouteStatus; }
        public void setUnmappedRouteStatus(int unmappedRouteStatus) { this.unmappedRouteStatus = unmappedRouteStatus; }
    }

    public static class ForwardingConfig {
        private List<String> strippedResponseHeaders = new ArrayList<>(List.of("Authorization"));

        public List<String> getStrippedResponseHeaders() { return strippedResponseHeaders; }
        public void setStrippedResponseHeaders(List<String> strippedResponseHeaders) {
            this.strippedResponseHeaders = strippedResponseHeaders != null ? strippedResponseHeaders : new ArrayList<>();
        }
    }

    public static class ResilienceConfig {
        private PolicyConfig identityProvider = PolicyConfig.identityProviderDefaults();
        private PolicyConfig destination = PolicyConfig.destinationDefaults();

        public PolicyConfig getIdentityProvider() { return identityProvider; }
        public void setIdentityProvider(PolicyConfig identityProvider) { this.identityProvider = identityProvider; }
        public PolicyConfig getDestination() { return destination; }
        public void setDestination(PolicyConfig destination) { this.destination = destination; }
    }

    /**
     * Timeout, retry and circuit breaker settings for one failure domain.
     * {@code maxRetries} is ignored for destinations: proxied calls are never retried.
     */
    public static class PolicyConfig {
        private Duration attemptTimeout = Duration.ofSeconds(5);
        private Duration totalTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private double jitter = 0.5;
        private float failureRateThreshold = 50;
        private int slidingWindowSeconds = 10;
        private int minimumNumberOfCalls = 5;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);

        static PolicyConfig identityProviderDefaults() {
            return new PolicyConfig();
        }

        static PolicyConfig destinationDefaults() {
            PolicyConfig config = new PolicyConfig();
            config.setAttemptTimeout(Duration.ofSeconds(30));
            config.setMaxRetries(0);
            return config;
        }

        public Duration getAttemptTimeout() { return attemptTimeout; }
        public void setAttemptTimeout(Duration attemptTimeout) { this.attemptTimeout = attemptTimeout; }
        public Duration getTotalTimeout() { return totalTimeout; }
        public void setTotalTimeout(Duration totalTimeout) { this.totalTimeout = totalTimeout; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
        public float getFailureRateThreshold() { return failureRateThreshold; }
        public void setFailureRateThreshold(float failureRateThreshold) { this.failureRateThreshold = failureRateThreshold; }
        public int getSlidingWindowSeconds() { return slidingWindowSeconds; }
        public void setSlidingWindowSeconds(int slidingWindowSeconds) { this.slidingWindowSeconds = slidingWindowSeconds; }
        public int getMinimumNumberOfCalls() { return minimumNumberOfCalls; }
        public void setMinimumNumberOfCalls(int minimumNumberOfCalls) { this.minimumNumberOfCalls = minimumNumberOfCalls; }
        public Duration getWaitDurationInOpenState() { return waitDurationInOpenState; }
        public void setWaitDurationInOpenState(Duration waitDurationInOpenState) { this.waitDurationInOpenState = waitDurationInOpenState; }
    }

    public static class RevocationConfig {
        private boolean enabled = false;
        private String keyPrefix = "gateway:revoked:";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
    }

    /**
     * Fail startup on incomplete or contradictory configuration.
     *
     * @throws IllegalStateException describing every problem found
     */
    @PostConstruct
    public void validate() {
        List<String> problems = new ArrayList<>();
        requireText(problems, "gateway.jwt.issuer", jwt.getIssuer());
        requireText(problems, "gateway.jwt.audience", jwt.getAudience());
        requireText(problems, "gateway.jwt.jwks-uri", jwt.getJwksUri());
        requireText(problems, "gateway.exchange.token-endpoint", exchange.getTokenEndpoint());
        requireText(problems, "gateway.exchange.client-id", exchange.getClientId());
        requireText(problems, "gateway.exchange.client-secret", exchange.getClientSecret());

        if (jwt.getClockSkew() == null || jwt.getClockSkew().isNegative()) {
            problems.add("gateway.jwt.clock-skew must not be negative");
        }
        if (exchange.getRefreshBuffer() == null || exchange.getRefreshBuffer().isNegative()) {
            problems.add("gateway.exchange.refresh-buffer must not be negative");
        }
        if (routing.getUnmappedRoutePolicy() == null) {
            problems.add("gateway.routing.unmapped-route-policy is required");
        }
        if (routing.getUnmappedRouteStatus() != 404 && routing.getUnmappedRouteStatus() != 501) {
            problems.add("gateway.routing.unmapped-route-status must be 404 or 501");
        }
        routing.getAudiences().forEach((routeId, audience) ->
            requireText(problems, "gateway.routing.audiences." + routeId, audience));
        if (resilience.getIdentityProvider().getMaxRetries() < 0) {
            problems.add("gateway.resilience.identity-provider.max-retries must not be negative");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid gateway configuration: " + String.join("; ", problems));
        }
        configurationWarnings().forEach(warning -> log.warn("Gateway configuration: {}", warning));
    }

    /**
     * Settings that are valid but likely to defeat caching.
     */
    List<String> configurationWarnings() {
        List<String> warnings = new ArrayList<>();
        Duration refreshBuffer = exchange.getRefreshBuffer();
        if (refreshBuffer != null && refreshBuffer.compareTo(LARGE_REFRESH_BUFFER) > 0) {
            warnings.add("gateway.exchange.refresh-buffer " + refreshBuffer
                + " exceeds " + LARGE_REFRESH_BUFFER + "; exchanged tokens with shorter lifetimes are never cached");
        }
        return warnings;
    }

    private static void requireText(List<String> problems, String name, String value) {
        if (value == null || value.isBlank()) {
            problems.add(name + " is required");
        }
    }

    /**
     * WebClient for the identity provider (JWKS and token endpoint)
     */
    @Bean
    public WebClient identityProviderWebClient() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(1024 * 1024)) // 1MB buffer for JWKS and token responses
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExchangeCache exchangeCache(Clock clock) {
        return new InMemoryExchangeCache(clock, exchange.getRefreshBuffer());
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public ResiliencePolicies resiliencePolicies(CircuitBreakerRegistry circuitBreakerRegistry) {
        return new ResiliencePolicies(
            circuitBreakerRegistry,
            resilience.getIdentityProvider(),
            resilience.getDestination());
    }

    /**
     * Get configured public paths
     */
    public List<String> getPublicPaths() {
        if (publicPaths == null || publicPaths.isEmpty()) {
            return getDefaultPublicPaths();
        }
        return publicPaths;
    }

    // Getters and setters for @ConfigurationProperties
    public JwtConfig getJwt() { return jwt; }
    public void setJwt(JwtConfig jwt) { this.jwt = jwt; }
    public ExchangeConfig getExchange() { return exchange; }
    public void setExchange(ExchangeConfig exchange) { this.exchange = exchange; }
    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }
    public ForwardingConfig getForwarding() { return forwarding; }
    public void setForwarding(ForwardingConfig forwarding) { this.forwarding = forwarding; }
    public ResilienceConfig getResilience() { return resilience; }
    public void setResilience(ResilienceConfig resilience) { this.resilience = resilience; }
    public RevocationConfig getRevocation() { return revocation; }
    public void setRevocation(RevocationConfig revocation) { this.revocation = revocation; }
    public void setPublicPaths(List<String> publicPaths) {
        this.publicPaths = publicPaths != null ? publicPaths : new ArrayList<>();
    }

    /**
     * Default public paths if not configured
     */
    private List<String> getDefaultPublicPaths() {
        return List.of(
            "/api/auth/**"
        );
    }
}
