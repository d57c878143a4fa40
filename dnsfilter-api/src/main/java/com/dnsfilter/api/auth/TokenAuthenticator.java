package com.dnsfilter.api.auth;

import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.core.domain.Account;
import com.dnsfilter.core.domain.AuthToken;
import com.dnsfilter.core.domain.Realm;
import com.dnsfilter.core.repository.AccountRepository;
import com.dnsfilter.core.repository.AuthTokenRepository;
import com.dnsfilter.core.repository.RealmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Optional;

/**
 * Resolves a presented bearer token to its realm.
 *
 * Order of checks: presence, format, prefix lookup, constant-time hash
 * comparison, token state, owning account state. Nothing here throws for a
 * rejected token; every outcome is an {@link AuthResult}.
 */
@Service
public class TokenAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticator.class);

    private final AuthTokenRepository tokenRepository;
    private final RealmRepository realmRepository;
    private final AccountRepository accountRepository;
    private final TokenUsageRecorder usageRecorder;

    public TokenAuthenticator(
            AuthTokenRepository tokenRepository,
            RealmRepository realmRepository,
            AccountRepository accountRepository,
            TokenUsageRecorder usageRecorder) {
        this.tokenRepository = tokenRepository;
        this.realmRepository = realmRepository;
        this.accountRepository = accountRepository;
        this.usageRecorder = usageRecorder;
    }

    /**
     * @param sourceIp recorded as the token's last-used address on success, may be null
     */
    @Transactional(readOnly = true)
    public AuthResult authenticate(String presentedToken, String sourceIp) {
        if (presentedToken == null || presentedToken.isBlank()) {
            return AuthResult.unauthenticated(AuthFailure.MISSING_TOKEN, ErrorCode.MISSING_TOKEN);
        }

        Optional<TokenFormat.ParsedToken> parsed = TokenFormat.parse(presentedToken);
        if (parsed.isEmpty()) {
            log.debug("Rejected token with invalid format");
            return AuthResult.unauthenticated(AuthFailure.INVALID_FORMAT, ErrorCode.INVALID_FORMAT);
        }

        String prefix = parsed.get().lookupPrefix();
        String presentedHash = TokenFormat.hash(presentedToken);
        String fingerprint = TokenFormat.fingerprint(presentedToken);

        Optional<AuthToken> stored = tokenRepository.findByTokenPrefix(prefix);
        if (stored.isEmpty()) {
            log.info("Unknown token prefix {}", prefix);
            return AuthResult.unauthenticated(AuthFailure.NOT_FOUND, ErrorCode.TOKEN_NOT_FOUND,
                    null, null, null, prefix, fingerprint);
        }

        AuthToken token = stored.get();
        // the hash covers the alias too, so a wrong alias fails here as well
        if (!MessageDigest.isEqual(
                presentedHash.getBytes(StandardCharsets.US_ASCII),
                token.getSecretHash().getBytes(StandardCharsets.US_ASCII))) {
            log.warn("Token hash mismatch for prefix {}", prefix);
            return AuthResult.unauthenticated(AuthFailure.INVALID_CREDENTIAL, ErrorCode.TOKEN_HASH_MISMATCH,
                    token, null, null, prefix, fingerprint);
        }

        Realm realm = realmRepository.findById(token.getRealmId()).orElse(null);
        Account account = realm == null ? null : accountRepository.findById(realm.getAccountId()).orElse(null);
        if (realm == null || account == null) {
            log.error("Token {} has no owning realm or account", token.getId());
            return AuthResult.unauthenticated(AuthFailure.EXPIRED_OR_DISABLED, ErrorCode.ORPHANED_TOKEN,
                    token, realm, account, prefix, fingerprint);
        }

        Instant now = Instant.now();
        if (!token.isActive()) {
            return AuthResult.unauthenticated(AuthFailure.EXPIRED_OR_DISABLED, ErrorCode.TOKEN_REVOKED,
                    token, realm, account, prefix, fingerprint);
        }
        if (token.isExpired(now)) {
            return AuthResult.unauthenticated(AuthFailure.EXPIRED_OR_DISABLED, ErrorCode.TOKEN_EXPIRED,
                    token, realm, account, prefix, fingerprint);
        }
        if (!account.canAuthenticate()) {
            return AuthResult.unauthenticated(AuthFailure.EXPIRED_OR_DISABLED, ErrorCode.ACCOUNT_DISABLED,
                    token, realm, account, prefix, fingerprint);
        }

        usageRecorder.recordUsage(token.getId(), now, sourceIp);
        return AuthResult.authenticated(token, realm, account, fingerprint);
    }
}
