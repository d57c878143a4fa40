package com.dnsfilter.core.repository;

import com.dnsfilter.core.domain.Realm;
import com.dnsfilter.core.domain.Realm.RealmType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for realms.
 */
@Repository
public interface RealmRepository extends JpaRepository<Realm, UUID> {

    List<Realm> findByAccountIdOrderByCreatedAtAsc(UUID accountId);

    /**
     * Backs the (account, realm_value, realm_type) uniqueness check.
     */
    boolean existsByAccountIdAndRealmValueAndRealmType(UUID accountId, String realmValue, RealmType realmType);
}
