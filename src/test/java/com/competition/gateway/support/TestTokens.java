package com.competition.gateway.support;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Mints RS256 tokens the way the identity provider does, for tests.
 */
public final class TestTokens {

    public static final String ISSUER = "https://idp.test/realms/competition";
    public static final String AUDIENCE = "gateway";
    public static final String KEY_ID = "test-key";
    public static final String SUBJECT = "user-1";
    public static final String TENANT = "tenant-a";

    private static final RSAKey SIGNING_KEY = generateKey(KEY_ID);

    private TestTokens() {
    }

    public static RSAKey signingKey() {
        return SIGNING_KEY;
    }

    public static RSAKey publicKey() {
        return SIGNING_KEY.toPublicJWK();
    }

    public static RSAKey generateKey(String keyId) {
        try {
            return new RSAKeyGenerator(2048)
                .keyID(keyId)
                .keyUse(KeyUse.SIGNATURE)
                .generate();
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to generate RSA key", e);
        }
    }

    /**
     * Claims accepted by the gateway at {@code now}: one hour lifetime.
     */
    public static JWTClaimsSet.Builder validClaims(Instant now) {
        return new JWTClaimsSet.Builder()
            .issuer(ISSUER)
            .audience(AUDIENCE)
            .subject(SUBJECT)
            .claim("tenant_id", TENANT)
            .claim("roles", List.of("Organizer"))
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plusSeconds(3600)))
            .jwtID(UUID.randomUUID().toString());
    }

    public static String validToken(Instant now) {
        return sign(validClaims(now).build());
    }

    public static String sign(JWTClaimsSet claims) {
        return sign(claims, SIGNING_KEY);
    }

    public static String sign(JWTClaimsSet claims, RSAKey key) {
        try {
            SignedJWT jwt = new SignedJWT(
                new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(key.getKeyID()).build(),
                claims);
            jwt.sign(new RSASSASigner(key));
            return jwt.serialize();
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }

    /**
     * Public JWKS document containing the signing key.
     */
    public static String jwksJson() {
        return new JWKSet(publicKey()).toString();
    }
}
