package com.dnsfilter.api.authz;

import com.dnsfilter.core.domain.DnsOperation;
import com.dnsfilter.core.domain.ManagedDomainRoot;

import java.util.List;
import java.util.Set;

/**
 * Snapshot of a managed domain root, detached from persistence.
 * Empty record type or operation sets mean no restriction at this layer.
 */
public record DomainRootPolicy(
        String rootDomain,
        String backendName,
        boolean allowApexAccess,
        int minSubdomainDepth,
        int maxSubdomainDepth,
        Set<String> allowedRecordTypes,
        Set<DnsOperation> allowedOperations) {

    public DomainRootPolicy {
        allowedRecordTypes = Set.copyOf(allowedRecordTypes);
        allowedOperations = Set.copyOf(allowedOperations);
    }

    public static DomainRootPolicy from(ManagedDomainRoot root) {
        Set<DnsOperation> operations = root.getAllowedOperationSet();
        if (operations.isEmpty() && !root.getAllowedOperations().isEmpty()) {
            // an empty set would read as unrestricted
            throw new IllegalStateException("Domain root " + root.getRootDomain()
                    + " lists no recognizable operations: " + root.getAllowedOperations());
        }
        return new DomainRootPolicy(
                root.getRootDomain(),
                root.getBackendName(),
                root.isAllowApexAccess(),
                root.getMinSubdomainDepth(),
                root.getMaxSubdomainDepth(),
                Set.copyOf(root.getAllowedRecordTypes()),
                operations);
    }

    public static DomainRootPolicy of(String rootDomain, String backendName, boolean allowApexAccess,
                                      int minSubdomainDepth, int maxSubdomainDepth) {
        return new DomainRootPolicy(rootDomain, backendName, allowApexAccess,
                minSubdomainDepth, maxSubdomainDepth, Set.of(), Set.of());
    }

    public DomainRootPolicy withRecordTypes(List<String> recordTypes) {
        return new DomainRootPolicy(rootDomain, backendName, allowApexAccess,
                minSubdomainDepth, maxSubdomainDepth, Set.copyOf(recordTypes), allowedOperations);
    }

    public DomainRootPolicy withOperations(Set<DnsOperation> operations) {
        return new DomainRootPolicy(rootDomain, backendName, allowApexAccess,
                minSubdomainDepth, maxSubdomainDepth, allowedRecordTypes, operations);
    }
}
