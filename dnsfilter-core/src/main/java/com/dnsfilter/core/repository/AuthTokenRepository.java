package com.dnsfilter.core.repository;

import com.dnsfilter.core.domain.AuthToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for realm-scoped API tokens.
 */
@Repository
public interface AuthTokenRepository extends JpaRepository<AuthToken, UUID> {

    /**
     * Single indexed lookup used by authentication; the prefix is unique.
     */
    Optional<AuthToken> findByTokenPrefix(String tokenPrefix);

    boolean existsByTokenPrefix(String tokenPrefix);

    boolean existsByRealmIdAndAlias(UUID realmId, String alias);

    List<AuthToken> findByRealmIdOrderByCreatedAtAsc(UUID realmId);

    @Modifying
    @Query("DELETE FROM AuthToken t WHERE t.realmId = :realmId")
    int deleteAllByRealmId(@Param("realmId") UUID realmId);

    /**
     * Usage bookkeeping as a single-row update, no read-modify-write.
     */
    @Modifying
    @Query("UPDATE AuthToken t SET t.lastUsedAt = :usedAt, t.lastUsedIp = :ip, t.useCount = t.useCount + 1 WHERE t.id = :id")
    int recordUsage(@Param("id") UUID id, @Param("usedAt") Instant usedAt, @Param("ip") String ip);
}
