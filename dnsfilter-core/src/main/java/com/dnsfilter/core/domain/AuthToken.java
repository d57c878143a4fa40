package com.dnsfilter.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Bearer credential bound to exactly one realm.
 *
 * Only the SHA-256 hash of the full token is stored; the raw value is handed
 * to the owner once at creation. The token prefix is the non-secret lookup key
 * and is globally unique, so authentication needs one indexed read before the
 * hash comparison.
 *
 * A token may carry its own record-type, operation and source-IP lists. They
 * narrow the realm's grant and never widen it; an empty list adds nothing.
 */
@Entity
@Table(name = "auth_tokens",
    uniqueConstraints = @UniqueConstraint(name = "uq_realm_token_alias", columnNames = {"realm_id", "alias"}),
    indexes = {
        @Index(name = "idx_token_realm", columnList = "realm_id"),
        @Index(name = "idx_token_prefix", columnList = "token_prefix", unique = true)
    })
public class AuthToken {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "realm_id", nullable = false, updatable = false)
    private UUID realmId;

    @NotNull
    @Column(name = "alias", nullable = false, length = 32)
    private String alias;

    @NotNull
    @Column(name = "token_prefix", nullable = false, unique = true, length = 16)
    private String tokenPrefix;

    @NotNull
    @Column(name = "secret_hash", nullable = false, length = 64)
    private String secretHash;

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_record_types", length = 500)
    private List<String> allowedRecordTypes;

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_operations", length = 100)
    private List<String> allowedOperations;

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_ip_ranges", length = 2000)
    private List<String> allowedIpRanges;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "last_used_ip", length = 45)
    private String lastUsedIp;

    @Column(name = "use_count", nullable = false)
    private long useCount;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoked_reason", length = 500)
    private String revokedReason;

    protected AuthToken() {}

    /**
     * Creates a new active token.
     * The secret hash is the SHA-256 hex digest of the full presented token.
     */
    public static AuthToken create(UUID realmId, String alias, String tokenPrefix, String secretHash, Instant expiresAt) {
        if (realmId == null) {
            throw new IllegalArgumentException("Realm ID is required");
        }
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Alias is required");
        }
        if (tokenPrefix == null || tokenPrefix.isBlank()) {
            throw new IllegalArgumentException("Token prefix is required");
        }
        if (secretHash == null || secretHash.length() != 64) {
            throw new IllegalArgumentException("Secret hash must be 64 character SHA-256 hex");
        }

        var token = new AuthToken();
        token.id = UUID.randomUUID();
        token.realmId = realmId;
        token.alias = alias;
        token.tokenPrefix = tokenPrefix;
        token.secretHash = secretHash;
        token.expiresAt = expiresAt;
        token.active = true;
        token.createdAt = Instant.now();
        token.useCount = 0;
        return token;
    }

    /**
     * Revokes this token. Revocation is permanent.
     */
    public void revoke(String reason) {
        if (!this.active) {
            throw new IllegalStateException("Token already revoked");
        }
        this.active = false;
        this.revokedAt = Instant.now();
        this.revokedReason = reason;
    }

    /**
     * Replaces this token's own restrictions. Null or empty lists leave the
     * realm's grant as the only limit.
     */
    public void restrict(List<String> recordTypes, Set<DnsOperation> operations, List<String> ipRanges) {
        this.allowedRecordTypes = recordTypes == null ? List.of() : List.copyOf(recordTypes);
        this.allowedOperations = operations == null ? List.of() : operations.stream()
                .sorted()
                .map(DnsOperation::symbol)
                .toList();
        this.allowedIpRanges = ipRanges == null ? List.of() : List.copyOf(ipRanges);
    }

    /**
     * Operations granted at token level. Unknown stored symbols are dropped.
     * Only meaningful when {@link #restrictsOperations()} is true.
     */
    public Set<DnsOperation> getOperationSet() {
        Set<DnsOperation> result = EnumSet.noneOf(DnsOperation.class);
        if (allowedOperations != null) {
            allowedOperations.forEach(symbol -> DnsOperation.fromSymbol(symbol).ifPresent(result::add));
        }
        return result;
    }

    public boolean restrictsOperations() {
        return allowedOperations != null && !allowedOperations.isEmpty();
    }

    public boolean restrictsRecordTypes() {
        return allowedRecordTypes != null && !allowedRecordTypes.isEmpty();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isUsable(Instant now) {
        return active && !isExpired(now);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getRealmId() { return realmId; }
    public String getAlias() { return alias; }
    public String getTokenPrefix() { return tokenPrefix; }
    public String getSecretHash() { return secretHash; }
    public List<String> getAllowedRecordTypes() { return allowedRecordTypes == null ? List.of() : List.copyOf(allowedRecordTypes); }
    public List<String> getAllowedOperations() { return allowedOperations == null ? List.of() : List.copyOf(allowedOperations); }
    public List<String> getAllowedIpRanges() { return allowedIpRanges == null ? List.of() : List.copyOf(allowedIpRanges); }
    public Instant getExpiresAt() { return expiresAt; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastUsedAt() { return lastUsedAt; }
    public String getLastUsedIp() { return lastUsedIp; }
    public long getUseCount() { return useCount; }
    public Instant getRevokedAt() { return revokedAt; }
    public String getRevokedReason() { return revokedReason; }
}
