package com.dnsfilter.api.auth;

import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.core.domain.Account;
import com.dnsfilter.core.domain.AuthToken;
import com.dnsfilter.core.domain.Realm;

/**
 * Outcome of one authentication attempt.
 *
 * Failed attempts keep whatever was resolved before the failure (token,
 * realm, account) so the audit entry can attribute the attempt. The lookup
 * prefix and fingerprint are non-secret and safe to log.
 */
public record AuthResult(
        AuthFailure failure,
        ErrorCode errorCode,
        AuthToken token,
        Realm realm,
        Account account,
        String tokenPrefix,
        String tokenFingerprint) {

    public static AuthResult authenticated(AuthToken token, Realm realm, Account account, String fingerprint) {
        return new AuthResult(null, null, token, realm, account, token.getTokenPrefix(), fingerprint);
    }

    public static AuthResult unauthenticated(AuthFailure failure, ErrorCode errorCode) {
        return new AuthResult(failure, errorCode, null, null, null, null, null);
    }

    public static AuthResult unauthenticated(
            AuthFailure failure,
            ErrorCode errorCode,
            AuthToken token,
            Realm realm,
            Account account,
            String tokenPrefix,
            String fingerprint) {
        return new AuthResult(failure, errorCode, token, realm, account, tokenPrefix, fingerprint);
    }

    public boolean isAuthenticated() {
        return failure == null;
    }
}
