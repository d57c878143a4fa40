package com.dnsfilter.api.auth;

/**
 * Externally visible authentication failure kinds.
 * NOT_FOUND and INVALID_CREDENTIAL must produce identical responses.
 */
public enum AuthFailure {
    MISSING_TOKEN,
    INVALID_FORMAT,
    NOT_FOUND,
    INVALID_CREDENTIAL,
    EXPIRED_OR_DISABLED
}
