package com.competition.gateway.auth;

import com.competition.gateway.support.MutableClock;
import com.competition.gateway.support.TestGatewayConfig;
import com.competition.gateway.support.TestTokens;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("InboundAuthenticator")
class InboundAuthenticatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private JwksService jwksService;
    private InboundAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        jwksService = mock(JwksService.class);
        when(jwksService.getPublicKey(TestTokens.KEY_ID)).thenReturn(Mono.just(TestTokens.publicKey()));
        authenticator = new InboundAuthenticator(jwksService, TestGatewayConfig.create(), new MutableClock(NOW));
    }

    private AuthenticationException.Reason failureReason(String token) {
        Throwable error = authenticator.authenticate(token)
            .map(identity -> (Throwable) new AssertionError("expected authentication failure"))
            .onErrorResume(Mono::just)
            .block();
        assertThat(error).isInstanceOf(AuthenticationException.class);
        return ((AuthenticationException) error).getReason();
    }

    @Nested
    @DisplayName("Valid tokens")
    class ValidTokens {

        @Test
        @DisplayName("derives subject, tenant, roles and expiry")
        void derivesIdentity() {
            String token = TestTokens.validToken(NOW);

            StepVerifier.create(authenticator.authenticate(token))
                .assertNext(identity -> {
                    assertThat(identity.subject()).isEqualTo(TestTokens.SUBJECT);
                    assertThat(identity.tenantId()).isEqualTo(TestTokens.TENANT);
                    assertThat(identity.roles()).containsExactly("Organizer");
                    assertThat(identity.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
                    assertThat(identity.tokenId()).isNotBlank();
                    assertThat(identity.rawToken()).isEqualTo(token);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("never prints the raw token")
        void toStringHidesToken() {
            String token = TestTokens.validToken(NOW);

            InboundIdentity identity = authenticator.authenticate(token).block();

            assertThat(identity).isNotNull();
            assertThat(identity.toString()).doesNotContain(token);
        }

        @Test
        @DisplayName("accepts an audience list containing the gateway")
        void acceptsAudienceList() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW)
                .audience(List.of("account", TestTokens.AUDIENCE))
                .build());

            StepVerifier.create(authenticator.authenticate(token))
                .expectNextCount(1)
                .verifyComplete();
        }

        @Test
        @DisplayName("accepts a token expired within the clock skew")
        void acceptsWithinSkew() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW)
                .expirationTime(Date.from(NOW.minusSeconds(120)))
                .build());

            StepVerifier.create(authenticator.authenticate(token))
                .expectNextCount(1)
                .verifyComplete();
        }

        @Test
        @DisplayName("falls back to realm_access roles")
        void realmAccessRoles() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW)
                .claim("roles", null)
                .claim("realm_access", Map.of("roles", List.of("Judge", "Participant")))
                .build());

            InboundIdentity identity = authenticator.authenticate(token).block();

            assertThat(identity).isNotNull();
            assertThat(identity.roles()).containsExactlyInAnyOrder("Judge", "Participant");
        }
    }

    @Nested
    @DisplayName("Rejected tokens")
    class RejectedTokens {

        @Test
        @DisplayName("missing token")
        void missingToken() {
            assertThat(failureReason(null)).isEqualTo(AuthenticationException.Reason.MISSING_TOKEN);
            assertThat(failureReason("  ")).isEqualTo(AuthenticationException.Reason.MISSING_TOKEN);
        }

        @Test
        @DisplayName("not a JWT")
        void malformed() {
            assertThat(failureReason("not-a-jwt")).isEqualTo(AuthenticationException.Reason.MALFORMED_TOKEN);
        }

        @Test
        @DisplayName("wrong issuer")
        void wrongIssuer() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW)
                .issuer("https://evil.example/realms/other")
                .build());

            assertThat(failureReason(token)).isEqualTo(AuthenticationException.Reason.WRONG_ISSUER);
        }

        @Test
        @DisplayName("audience not including the gateway")
        void wrongAudience() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW)
                .audience("competition-service")
                .build());

            assertThat(failureReason(token)).isEqualTo(AuthenticationException.Reason.WRONG_AUDIENCE);
        }

        @Test
        @DisplayName("signed by a different key with the same key id")
        void forgedSignature() {
            RSAKey attackerKey = TestTokens.generateKey(TestTokens.KEY_ID);
            String token = TestTokens.sign(TestTokens.validClaims(NOW).build(), attackerKey);

            assertThat(failureReason(token)).isEqualTo(AuthenticationException.Reason.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("expired beyond the clock skew")
        void expired() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW)
                .expirationTime(Date.from(NOW.minusSeconds(600)))
                .build());

            assertThat(failureReason(token)).isEqualTo(AuthenticationException.Reason.EXPIRED);
        }

        @Test
        @DisplayName("not yet valid beyond the clock skew")
        void notYetValid() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW)
                .notBeforeTime(Date.from(NOW.plusSeconds(600)))
                .build());

            assertThat(failureReason(token)).isEqualTo(AuthenticationException.Reason.NOT_YET_VALID);
        }

        @Test
        @DisplayName("without subject")
        void missingSubject() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW).subject(null).build());

            assertThat(failureReason(token)).isEqualTo(AuthenticationException.Reason.MISSING_SUBJECT);
        }

        @Test
        @DisplayName("unknown key id is reported by the key source")
        void unknownKey() {
            when(jwksService.getPublicKey("rotated-away")).thenReturn(Mono.error(new AuthenticationException(
                AuthenticationException.Reason.UNKNOWN_KEY, "JWK key not found: kid=rotated-away")));
            RSAKey otherKey = TestTokens.generateKey("rotated-away");
            String token = TestTokens.sign(TestTokens.validClaims(NOW).build(), otherKey);

            assertThat(failureReason(token)).isEqualTo(AuthenticationException.Reason.UNKNOWN_KEY);
        }

        @Test
        @DisplayName("malformed tokens never reach the key source")
        void malformedSkipsKeyLookup() {
            failureReason("a.b");

            verify(jwksService, never()).getPublicKey(anyString());
        }

        @Test
        @DisplayName("all failures share the generic public message")
        void genericPublicMessage() {
            String token = TestTokens.sign(TestTokens.validClaims(NOW).issuer("https://other").build());

            assertThatThrownBy(() -> authenticator.authenticate(token).block())
                .isInstanceOfSatisfying(AuthenticationException.class, error -> {
                    assertThat(error.getPublicMessage()).isEqualTo("Authentication required");
                    assertThat(error.getErrorCode()).isEqualTo("UNAUTHORIZED");
                    assertThat(error.getPublicMessage()).doesNotContain("issuer");
                });
        }
    }

    @Nested
    @DisplayName("Tenant")
    class Tenant {

        @Test
        @DisplayName("missing tenant claim is forbidden, not unauthenticated")
        void missingTenant() {
            JWTClaimsSet claims = TestTokens.validClaims(NOW).claim("tenant_id", null).build();
            String token = TestTokens.sign(claims);

            StepVerifier.create(authenticator.authenticate(token))
                .expectError(TenantMissingException.class)
                .verify();
        }
    }
}
