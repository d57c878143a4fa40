package com.dnsfilter.api.ip;

/**
 * Result of a whitelist check. A misconfigured whitelist is never allowed.
 */
public record WhitelistVerdict(boolean allowed, String misconfiguredEntry, String detail) {

    private static final WhitelistVerdict ALLOWED = new WhitelistVerdict(true, null, null);

    public static WhitelistVerdict allow() {
        return ALLOWED;
    }

    public static WhitelistVerdict deny(String detail) {
        return new WhitelistVerdict(false, null, detail);
    }

    public static WhitelistVerdict misconfigured(String entry, String detail) {
        return new WhitelistVerdict(false, entry, detail);
    }

    public boolean isMisconfigured() {
        return misconfiguredEntry != null;
    }
}
