package com.dnsfilter.core.repository;

import com.dnsfilter.core.domain.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for accounts.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    boolean existsByUsernameIgnoreCase(String username);

    boolean existsByEmailIgnoreCase(String email);
}
