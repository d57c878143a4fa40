package com.dnsfilter.api.auth;

/**
 * Extracts the token from an {@code Authorization: Bearer ...} header.
 */
public final class BearerTokens {

    private static final String SCHEME = "bearer";

    private BearerTokens() {}

    /**
     * @return the token, or null when the header is absent or not a bearer credential
     */
    public static String extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String header = authorizationHeader.trim();
        int space = header.indexOf(' ');
        if (space <= 0 || !header.substring(0, space).equalsIgnoreCase(SCHEME)) {
            return null;
        }
        String token = header.substring(space + 1).trim();
        return token.isEmpty() ? null : token;
    }
}
