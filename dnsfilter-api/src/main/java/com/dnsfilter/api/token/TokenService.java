package com.dnsfilter.api.token;

import com.dnsfilter.api.auth.TokenFormat;
import com.dnsfilter.api.backend.RecordTypes;
import com.dnsfilter.api.ip.IpWhitelistValidator;
import com.dnsfilter.core.domain.AuthToken;
import com.dnsfilter.core.domain.DnsOperation;
import com.dnsfilter.core.domain.Realm;
import com.dnsfilter.core.repository.AuthTokenRepository;
import com.dnsfilter.core.repository.RealmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Issues and revokes realm tokens.
 *
 * The raw token exists only in the {@link IssuedToken} returned at issuance;
 * the store keeps its hash and lookup prefix. Token restrictions may only
 * name record types and operations the realm itself grants.
 */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final int SECRET_LENGTH = 48;
    private static final int MAX_PREFIX_ATTEMPTS = 5;
    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final AuthTokenRepository tokenRepository;
    private final RealmRepository realmRepository;
    private final IpWhitelistValidator ipWhitelistValidator;
    private final SecureRandom secureRandom = new SecureRandom();

    public TokenService(
            AuthTokenRepository tokenRepository,
            RealmRepository realmRepository,
            IpWhitelistValidator ipWhitelistValidator) {
        this.tokenRepository = tokenRepository;
        this.realmRepository = realmRepository;
        this.ipWhitelistValidator = ipWhitelistValidator;
    }

    /**
     * Issues a token carrying the realm's full grant.
     *
     * @param expiresAt null for a token that never expires
     */
    @Transactional
    public IssuedToken issueToken(UUID realmId, String alias, Instant expiresAt) {
        return issueToken(realmId, alias, expiresAt, TokenRestrictions.NONE);
    }

    @Transactional
    public IssuedToken issueToken(UUID realmId, String alias, Instant expiresAt, TokenRestrictions restrictions) {
        Realm realm = realmRepository.findById(realmId)
                .orElseThrow(() -> new TokenIssueException("Realm not found: " + realmId));
        TokenRestrictions effective = restrictions == null ? TokenRestrictions.NONE : restrictions;
        checkWithinRealm(realm, effective);
        if (!TokenFormat.isValidAlias(alias)) {
            throw new TokenIssueException("Alias must be 1-" + TokenFormat.MAX_ALIAS_LENGTH
                    + " letters, digits or hyphens");
        }
        if (expiresAt != null && !expiresAt.isAfter(Instant.now())) {
            throw new TokenIssueException("Expiry must be in the future");
        }
        if (tokenRepository.existsByRealmIdAndAlias(realmId, alias)) {
            throw new TokenIssueException("Alias already used in this realm: " + alias);
        }

        for (int attempt = 0; attempt < MAX_PREFIX_ATTEMPTS; attempt++) {
            String secret = randomSecret();
            String prefix = secret.substring(0, TokenFormat.LOOKUP_PREFIX_LENGTH);
            if (tokenRepository.existsByTokenPrefix(prefix)) {
                log.debug("Token prefix collision, regenerating");
                continue;
            }
            String raw = TokenFormat.compose(alias, secret);
            AuthToken token = AuthToken.create(realmId, alias, prefix, TokenFormat.hash(raw), expiresAt);
            token.restrict(effective.recordTypes(), effective.operations(), effective.allowedIpRanges());
            token = tokenRepository.save(token);
            log.info("Issued token {} (prefix {}) for realm {}", token.getId(), prefix, realmId);
            return new IssuedToken(raw, token);
        }
        throw new TokenIssueException("Could not allocate a unique token prefix");
    }

    @Transactional
    public AuthToken revokeToken(UUID tokenId, String reason) {
        AuthToken token = tokenRepository.findById(tokenId)
                .orElseThrow(() -> new TokenNotFoundException("Token not found: " + tokenId));
        token.revoke(reason);
        log.info("Revoked token {} (prefix {}): {}", tokenId, token.getTokenPrefix(), reason);
        return token;
    }

    @Transactional(readOnly = true)
    public List<AuthToken> listTokens(UUID realmId) {
        return tokenRepository.findByRealmIdOrderByCreatedAtAsc(realmId);
    }

    private void checkWithinRealm(Realm realm, TokenRestrictions restrictions) {
        for (String type : restrictions.recordTypes()) {
            if (!RecordTypes.isSupported(type)) {
                throw new TokenIssueException("Unsupported record type: " + type);
            }
            if (realm.restrictsRecordTypes() && !realm.getRecordTypes().contains(type)) {
                throw new TokenIssueException("Record type not granted by realm: " + type);
            }
        }
        for (DnsOperation operation : restrictions.operations()) {
            if (realm.restrictsOperations() && !realm.getOperationSet().contains(operation)) {
                throw new TokenIssueException("Operation not granted by realm: " + operation.symbol());
            }
        }
        List<String> problems = ipWhitelistValidator.validateRanges(
                restrictions.allowedIpRanges(), restrictions.allowBroadRanges());
        if (!problems.isEmpty()) {
            throw new TokenIssueException(String.join("; ", problems));
        }
    }

    private String randomSecret() {
        char[] secret = new char[SECRET_LENGTH];
        for (int i = 0; i < secret.length; i++) {
            secret[i] = ALPHABET[secureRandom.nextInt(ALPHABET.length)];
        }
        return new String(secret);
    }

    /**
     * Raw token shown to the owner once, with its stored record.
     */
    public record IssuedToken(String rawToken, AuthToken token) {

        @Override
        public String toString() {
            return "IssuedToken{prefix=" + token.getTokenPrefix() + "}";
        }
    }

    /**
     * Token-level narrowing of the realm grant. Empty lists add no restriction.
     */
    public record TokenRestrictions(
            List<String> recordTypes,
            Set<DnsOperation> operations,
            List<String> allowedIpRanges,
            boolean allowBroadRanges) {

        public static final TokenRestrictions NONE = new TokenRestrictions(List.of(), Set.of(), List.of(), false);

        public TokenRestrictions {
            recordTypes = recordTypes == null ? List.of() : recordTypes.stream().map(String::trim).toList();
            operations = operations == null ? Set.of() : Set.copyOf(operations);
            allowedIpRanges = allowedIpRanges == null ? List.of() : allowedIpRanges.stream().map(String::trim).toList();
        }
    }

    public static class TokenIssueException extends RuntimeException {
        public TokenIssueException(String message) { super(message); }
    }

    public static class TokenNotFoundException extends RuntimeException {
        public TokenNotFoundException(String message) { super(message); }
    }
}
