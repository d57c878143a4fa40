package com.dnsfilter.core.repository;

import com.dnsfilter.core.domain.ManagedDomainRoot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Read access to domain-root policies.
 */
@Repository
public interface ManagedDomainRootRepository extends JpaRepository<ManagedDomainRoot, UUID> {

    /**
     * Candidate roots for a name: callers pass every label-suffix of the name.
     */
    List<ManagedDomainRoot> findByRootDomainInAndActiveTrue(Collection<String> rootDomains);
}
