package com.competition.gateway.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache key for an exchanged token: the SHA-256 of the subject token plus the target audience.
 * The raw subject token is never kept in the key.
 */
public record ExchangeCacheKey(String subjectHash, String audience) {

    public static ExchangeCacheKey of(String subjectToken, String audience) {
        return new ExchangeCacheKey(hashSubject(subjectToken), audience);
    }

    public static String hashSubject(String subjectToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(subjectToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
