package com.dnsfilter.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Realm - a permission grant scoping what a token may do.
 *
 * Scope is a domain pattern (host, subdomain tree or wildcard children) plus
 * optional record-type, operation and source-IP restrictions. An empty
 * restriction list means "no restriction" at this layer.
 */
@Entity
@Table(name = "realms",
    uniqueConstraints = @UniqueConstraint(name = "uq_account_realm",
        columnNames = {"account_id", "realm_value", "realm_type"}),
    indexes = @Index(name = "idx_realm_account", columnList = "account_id"))
public class Realm {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "realm_type", nullable = false, length = 20)
    private RealmType realmType;

    @NotNull
    @Column(name = "realm_value", nullable = false)
    private String realmValue;

    @Convert(converter = StringListConverter.class)
    @Column(name = "record_types", length = 500)
    private List<String> recordTypes;

    @Convert(converter = StringListConverter.class)
    @Column(name = "operations", length = 100)
    private List<String> operations;

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_ip_ranges", length = 2000)
    private List<String> allowedIpRanges;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum RealmType {
        HOST,       // exact hostname only
        SUBDOMAIN,  // the value itself and every name below it
        WILDCARD    // names below the value, never the value itself
    }

    protected Realm() {}

    public static Realm create(
            UUID accountId,
            RealmType realmType,
            String realmValue,
            List<String> recordTypes,
            Set<DnsOperation> operations,
            List<String> allowedIpRanges) {

        if (accountId == null) {
            throw new IllegalArgumentException("Account ID is required");
        }
        if (realmType == null) {
            throw new IllegalArgumentException("Realm type is required");
        }
        if (realmValue == null || realmValue.isBlank()) {
            throw new IllegalArgumentException("Realm value is required");
        }

        var realm = new Realm();
        realm.id = UUID.randomUUID();
        realm.accountId = accountId;
        realm.realmType = realmType;
        realm.realmValue = realmValue.trim().toLowerCase(Locale.ROOT);
        realm.recordTypes = recordTypes == null ? List.of() : List.copyOf(recordTypes);
        realm.operations = operations == null ? List.of() : operations.stream()
                .sorted()
                .map(DnsOperation::symbol)
                .toList();
        realm.allowedIpRanges = allowedIpRanges == null ? List.of() : List.copyOf(allowedIpRanges);
        realm.createdAt = Instant.now();
        return realm;
    }

    /**
     * Allowed operations as enum values. Unknown stored symbols are dropped,
     * which can only narrow the grant. Only meaningful when
     * {@link #restrictsOperations()} is true.
     */
    public Set<DnsOperation> getOperationSet() {
        Set<DnsOperation> result = EnumSet.noneOf(DnsOperation.class);
        if (operations != null) {
            operations.forEach(symbol -> DnsOperation.fromSymbol(symbol).ifPresent(result::add));
        }
        return result;
    }

    public boolean restrictsOperations() {
        return operations != null && !operations.isEmpty();
    }

    public boolean restrictsRecordTypes() {
        return recordTypes != null && !recordTypes.isEmpty();
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getAccountId() { return accountId; }
    public RealmType getRealmType() { return realmType; }
    public String getRealmValue() { return realmValue; }
    public List<String> getRecordTypes() { return recordTypes == null ? List.of() : List.copyOf(recordTypes); }
    public List<String> getOperations() { return operations == null ? List.of() : List.copyOf(operations); }
    public List<String> getAllowedIpRanges() { return allowedIpRanges == null ? List.of() : List.copyOf(allowedIpRanges); }
    public Instant getCreatedAt() { return createdAt; }

    public void setAllowedIpRanges(List<String> allowedIpRanges) {
        this.allowedIpRanges = allowedIpRanges == null ? List.of() : List.copyOf(allowedIpRanges);
    }

    @Override
    public String toString() {
        return "Realm{" + realmType + ":" + realmValue + "}";
    }
}
