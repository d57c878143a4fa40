package com.dnsfilter.api.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shape of a realm token: {@code naf_<alias>_<secret>}.
 *
 * Everything here runs before any store access, so a malformed token never
 * costs a database lookup.
 */
public final class TokenFormat {

    public static final String FIXED_PREFIX = "naf";
    public static final int MIN_LENGTH = 20;
    public static final int MAX_LENGTH = 128;
    public static final int MAX_ALIAS_LENGTH = 32;
    public static final int MIN_SECRET_LENGTH = 8;
    public static final int LOOKUP_PREFIX_LENGTH = 8;
    public static final int FINGERPRINT_LENGTH = 12;

    private static final Pattern CHARSET = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final Pattern ALIAS = Pattern.compile("^[A-Za-z0-9-]{1," + MAX_ALIAS_LENGTH + "}$");
    private static final Pattern SECRET = Pattern.compile("^[A-Za-z0-9]{" + MIN_SECRET_LENGTH + ",}$");

    private TokenFormat() {}

    /**
     * Splits a presented token into alias and secret.
     * Empty when the length, charset or structure is wrong.
     */
    public static Optional<ParsedToken> parse(String token) {
        if (token == null || token.length() < MIN_LENGTH || token.length() > MAX_LENGTH) {
            return Optional.empty();
        }
        if (!CHARSET.matcher(token).matches()) {
            return Optional.empty();
        }
        // the alias may contain '-' but never '_', so exactly two separators are expected
        String[] parts = token.split("_", -1);
        if (parts.length != 3 || !FIXED_PREFIX.equals(parts[0])) {
            return Optional.empty();
        }
        if (!ALIAS.matcher(parts[1]).matches() || !SECRET.matcher(parts[2]).matches()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedToken(parts[1], parts[2]));
    }

    public static boolean isValidAlias(String alias) {
        return alias != null && ALIAS.matcher(alias).matches();
    }

    public static String compose(String alias, String secret) {
        return FIXED_PREFIX + "_" + alias + "_" + secret;
    }

    /**
     * SHA-256 hex digest of the full token, the only form ever stored.
     */
    public static String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Short non-reversible identifier for correlating audit entries.
     */
    public static String fingerprint(String token) {
        return hash(token).substring(0, FINGERPRINT_LENGTH);
    }

    public record ParsedToken(String alias, String secret) {

        public String lookupPrefix() {
            return secret.substring(0, LOOKUP_PREFIX_LENGTH);
        }
    }
}
