package com.dnsfilter.api.authz;

import com.dnsfilter.core.domain.ManagedDomainRoot;
import com.dnsfilter.core.repository.ManagedDomainRootRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the managed domain root governing a name.
 */
@Service
public class DomainRootPolicyService {

    private final ManagedDomainRootRepository rootRepository;

    public DomainRootPolicyService(ManagedDomainRootRepository rootRepository) {
        this.rootRepository = rootRepository;
    }

    /**
     * Most specific active root equal to or above the domain.
     * Empty when the domain is malformed or no root covers it.
     */
    @Transactional(readOnly = true)
    public Optional<DomainRootPolicy> policyFor(String domain) {
        Optional<String> normalized = DomainName.normalize(domain);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        List<String> candidates = DomainName.selfAndParents(normalized.get());
        return rootRepository.findByRootDomainInAndActiveTrue(candidates).stream()
                .max(Comparator.comparingInt((ManagedDomainRoot root) -> root.getRootDomain().length()))
                .map(DomainRootPolicy::from);
    }
}
