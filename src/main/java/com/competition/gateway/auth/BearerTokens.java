package com.competition.gateway.auth;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from Authorization header values.
 */
public final class BearerTokens {

    private static final String BEARER = "bearer ";

    private BearerTokens() {
        // utility class
    }

    /**
     * @param authorizationHeader the full header value, e.g. {@code "Bearer eyJ..."} (may be null)
     * @return the token, or empty when the header is missing, not a bearer header or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER)) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
