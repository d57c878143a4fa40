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
 * Zone-level policy for a root domain and the backend that owns it.
 *
 * Maintained by administrators outside this service; read-only here.
 * Restrictions compose with realm restrictions and the tighter one wins.
 */
@Entity
@Table(name = "managed_domain_roots", indexes = {
    @Index(name = "idx_domain_root_domain", columnList = "root_domain", unique = true)
})
public class ManagedDomainRoot {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "root_domain", nullable = false, unique = true)
    private String rootDomain;

    @NotNull
    @Column(name = "backend_name", nullable = false, length = 64)
    private String backendName;

    @Column(name = "allow_apex_access", nullable = false)
    private boolean allowApexAccess;

    @Column(name = "min_subdomain_depth", nullable = false)
    private int minSubdomainDepth;

    @Column(name = "max_subdomain_depth", nullable = false)
    private int maxSubdomainDepth;

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_record_types", length = 500)
    private List<String> allowedRecordTypes;

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_operations", length = 100)
    private List<String> allowedOperations;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ManagedDomainRoot() {}

    public static ManagedDomainRoot create(
            String rootDomain,
            String backendName,
            boolean allowApexAccess,
            int minSubdomainDepth,
            int maxSubdomainDepth,
            List<String> allowedRecordTypes,
            Set<DnsOperation> allowedOperations) {

        if (rootDomain == null || rootDomain.isBlank()) {
            throw new IllegalArgumentException("Root domain is required");
        }
        if (backendName == null || backendName.isBlank()) {
            throw new IllegalArgumentException("Backend name is required");
        }
        if (minSubdomainDepth < 1) {
            throw new IllegalArgumentException("Minimum subdomain depth must be at least 1");
        }
        if (maxSubdomainDepth < minSubdomainDepth) {
            throw new IllegalArgumentException("Maximum subdomain depth must be >= minimum depth");
        }

        var root = new ManagedDomainRoot();
        root.id = UUID.randomUUID();
        root.rootDomain = rootDomain.trim().toLowerCase(Locale.ROOT);
        root.backendName = backendName;
        root.allowApexAccess = allowApexAccess;
        root.minSubdomainDepth = minSubdomainDepth;
        root.maxSubdomainDepth = maxSubdomainDepth;
        root.allowedRecordTypes = allowedRecordTypes == null ? List.of() : List.copyOf(allowedRecordTypes);
        root.allowedOperations = allowedOperations == null ? List.of() : allowedOperations.stream()
                .sorted()
                .map(DnsOperation::symbol)
                .toList();
        root.active = true;
        root.createdAt = Instant.now();
        return root;
    }

    public Set<DnsOperation> getAllowedOperationSet() {
        Set<DnsOperation> result = EnumSet.noneOf(DnsOperation.class);
        if (allowedOperations != null) {
            allowedOperations.forEach(symbol -> DnsOperation.fromSymbol(symbol).ifPresent(result::add));
        }
        return result;
    }

    public void deactivate() {
        this.active = false;
    }

    // Getters
    public UUID getId() { return id; }
    public String getRootDomain() { return rootDomain; }
    public String getBackendName() { return backendName; }
    public boolean isAllowApexAccess() { return allowApexAccess; }
    public int getMinSubdomainDepth() { return minSubdomainDepth; }
    public int getMaxSubdomainDepth() { return maxSubdomainDepth; }
    public List<String> getAllowedRecordTypes() { return allowedRecordTypes == null ? List.of() : List.copyOf(allowedRecordTypes); }
    public List<String> getAllowedOperations() { return allowedOperations == null ? List.of() : List.copyOf(allowedOperations); }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
}
