package com.competition.gateway.auth;

import com.competition.gateway.config.GatewayConfig;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inbound Authenticator
 *
 * <p>Validates the caller's bearer token and derives the {@link InboundIdentity}.
 * Checks run in a fixed order: signature, issuer, audience, expiry and not-before
 * (with clock skew tolerance), subject. Every failure is an {@link AuthenticationException};
 * the reason is logged by the caller but never returned to the client.
 */
@Service
public class InboundAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(InboundAuthenticator.class);

    private static final String KEYCLOAK_REALM_ACCESS = "realm_access";

    private final JwksService jwksService;
    private final Clock clock;
    private final String expectedIssuer;
    private final String expectedAudience;
    private final Duration clockSkew;
    private final String tenantClaim;
    private final String rolesClaim;

    public InboundAuthenticator(JwksService jwksService, GatewayConfig gatewayConfig, Clock clock) {
        this.jwksService = jwksService;
        this.clock = clock;
        this.expectedIssuer = gatewayConfig.getJwt().getIssuer();
        this.expectedAudience = gatewayConfig.getJwt().getAudience();
        this.clockSkew = gatewayConfig.getJwt().getClockSkew();
        this.tenantClaim = gatewayConfig.getJwt().getTenantClaim();
        this.rolesClaim = gatewayConfig.getJwt().getRolesClaim();
    }

    /**
     * Validate a bearer token and extract the caller's identity.
     *
     * @param token bearer token without the "Bearer " prefix (may be null)
     * @return the identity, or an {@link AuthenticationException} / {@link TenantMissingException} signal
     */
    public Mono<InboundIdentity> authenticate(String token) {
        if (token == null || token.isBlank()) {
            return Mono.error(new AuthenticationException(
                AuthenticationException.Reason.MISSING_TOKEN, "Bearer token is required"));
        }

        SignedJWT signedJWT;
        try {
            signedJWT = SignedJWT.parse(token);
        } catch (ParseException e) {
            return Mono.error(new AuthenticationException(
                AuthenticationException.Reason.MALFORMED_TOKEN, "Invalid JWT token format", e));
        }

        String kid = signedJWT.getHeader().getKeyID();
        if (kid == null) {
            return Mono.error(new AuthenticationException(
                AuthenticationException.Reason.MALFORMED_TOKEN, "JWT token missing Key ID (kid)"));
        }

        return jwksService.getPublicKey(kid)
            .flatMap(publicKey -> Mono.fromCallable(() -> validate(signedJWT, publicKey, token)));
    }

    private InboundIdentity validate(SignedJWT signedJWT, RSAKey publicKey, String rawToken) {
        // 1. Signature
        verifySignature(signedJWT, publicKey);

        JWTClaimsSet claims;
        try {
            claims = signedJWT.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new AuthenticationException(
                AuthenticationException.Reason.MALFORMED_TOKEN, "Invalid JWT claims", e);
        }

        // 2. Issuer
        if (!expectedIssuer.equals(claims.getIssuer())) {
            throw new AuthenticationException(AuthenticationException.Reason.WRONG_ISSUER,
                "JWT token from unexpected issuer: " + claims.getIssuer());
        }

        // 3. Audience
        List<String> audience = claims.getAudience();
        if (audience == null || !audience.contains(expectedAudience)) {
            throw new AuthenticationException(AuthenticationException.Reason.WRONG_AUDIENCE,
                "JWT token audience " + audience + " does not include " + expectedAudience);
        }

        // 4. Lifetime
        Instant now = clock.instant();
        Date expirationTime = claims.getExpirationTime();
        if (expirationTime == null) {
            throw new AuthenticationException(
                AuthenticationException.Reason.MALFORMED_TOKEN, "JWT token missing expiry");
        }
        if (!now.isBefore(expirationTime.toInstant().plus(clockSkew))) {
            throw new AuthenticationException(
                AuthenticationException.Reason.EXPIRED, "JWT token has expired at " + expirationTime.toInstant());
        }
        Date notBefore = claims.getNotBeforeTime();
        if (notBefore != null && now.plus(clockSkew).isBefore(notBefore.toInstant())) {
            throw new AuthenticationException(
                AuthenticationException.Reason.NOT_YET_VALID, "JWT token not valid before " + notBefore.toInstant());
        }

        // 5. Subject and tenant
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthenticationException(
                AuthenticationException.Reason.MISSING_SUBJECT, "JWT token missing subject");
        }
        Object tenant = claims.getClaim(tenantClaim);
        if (tenant == null || tenant.toString().isBlank()) {
            throw new TenantMissingException(subject);
        }

        log.debug("Token validated: subject={}, tenantId={}", subject, tenant);
        return new InboundIdentity(
            subject,
            tenant.toString(),
            extractRoles(claims),
            expirationTime.toInstant(),
            claims.getJWTID(),
            rawToken);
    }

    private void verifySignature(SignedJWT signedJWT, RSAKey publicKey) {
        try {
            JWSVerifier verifier = new RSASSAVerifier(publicKey);
            if (!signedJWT.verify(verifier)) {
                throw new AuthenticationException(
                    AuthenticationException.Reason.INVALID_SIGNATURE, "Invalid JWT signature");
            }
        } catch (JOSEException e) {
            throw new AuthenticationException(
                AuthenticationException.Reason.INVALID_SIGNATURE, "JWT signature verification failed", e);
        }
    }

    /**
     * Roles from the configured claim, falling back to Keycloak's {@code realm_access.roles}.
     */
    private Set<String> extractRoles(JWTClaimsSet claims) {
        Set<String> roles = new LinkedHashSet<>();
        addAll(roles, claims.getClaim(rolesClaim));
        if (roles.isEmpty()) {
            Object realmAccess = claims.getClaim(KEYCLOAK_REALM_ACCESS);
            if (realmAccess instanceof Map) {
                addAll(roles, ((Map<?, ?>) realmAccess).get("roles"));
            }
        }
        return roles;
    }

    private static void addAll(Set<String> roles, Object claimValue) {
        if (claimValue instanceof Collection) {
            for (Object role : (Collection<?>) claimValue) {
                if (role != null) {
                    roles.add(role.toString());
                }
            }
        }
    }
}
