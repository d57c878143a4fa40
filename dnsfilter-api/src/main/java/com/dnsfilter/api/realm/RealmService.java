package com.dnsfilter.api.realm;

import com.dnsfilter.api.authz.DomainName;
import com.dnsfilter.api.backend.RecordTypes;
import com.dnsfilter.api.ip.IpWhitelistValidator;
import com.dnsfilter.core.domain.DnsOperation;
import com.dnsfilter.core.domain.Realm;
import com.dnsfilter.core.domain.Realm.RealmType;
import com.dnsfilter.core.repository.AccountRepository;
import com.dnsfilter.core.repository.AuthTokenRepository;
import com.dnsfilter.core.repository.RealmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Creates and maintains realms.
 *
 * Everything stored here is validated first, so the authorization path
 * never meets a realm it cannot interpret.
 */
@Service
public class RealmService {

    private static final Logger log = LoggerFactory.getLogger(RealmService.class);

    private final RealmRepository realmRepository;
    private final AccountRepository accountRepository;
    private final AuthTokenRepository tokenRepository;
    private final IpWhitelistValidator ipWhitelistValidator;

    public RealmService(
            RealmRepository realmRepository,
            AccountRepository accountRepository,
            AuthTokenRepository tokenRepository,
            IpWhitelistValidator ipWhitelistValidator) {
        this.realmRepository = realmRepository;
        this.accountRepository = accountRepository;
        this.tokenRepository = tokenRepository;
        this.ipWhitelistValidator = ipWhitelistValidator;
    }

    @Transactional
    public Realm createRealm(CreateRealmCommand command) {
        if (!accountRepository.existsById(command.accountId())) {
            throw new InvalidRealmException("Account not found: " + command.accountId());
        }
        if (command.realmType() == null) {
            throw new InvalidRealmException("Realm type is required");
        }
        String realmValue = DomainName.normalize(command.realmValue())
                .orElseThrow(() -> new InvalidRealmException("Invalid realm domain: " + command.realmValue()));

        List<String> recordTypes = command.recordTypes() == null ? List.of() : command.recordTypes();
        for (String type : recordTypes) {
            if (!RecordTypes.isSupported(type)) {
                throw new InvalidRealmException("Unsupported record type: " + type);
            }
        }

        List<String> ranges = trimmed(command.allowedIpRanges());
        List<String> problems = ipWhitelistValidator.validateRanges(ranges, command.allowBroadRanges());
        if (!problems.isEmpty()) {
            throw new InvalidRealmException(String.join("; ", problems));
        }

        if (realmRepository.existsByAccountIdAndRealmValueAndRealmType(
                command.accountId(), realmValue, command.realmType())) {
            throw new DuplicateRealmException("Realm already exists: " + command.realmType() + " " + realmValue);
        }

        Realm realm = realmRepository.save(Realm.create(
                command.accountId(), command.realmType(), realmValue,
                recordTypes, command.operations(), ranges));
        log.info("Created realm {} {} for account {}", realm.getId(), realm, command.accountId());
        return realm;
    }

    @Transactional(readOnly = true)
    public List<Realm> listRealms(UUID accountId) {
        return realmRepository.findByAccountIdOrderByCreatedAtAsc(accountId);
    }

    @Transactional
    public Realm updateAllowedIpRanges(UUID realmId, List<String> allowedIpRanges, boolean allowBroadRanges) {
        Realm realm = find(realmId);
        List<String> ranges = trimmed(allowedIpRanges);
        List<String> problems = ipWhitelistValidator.validateRanges(ranges, allowBroadRanges);
        if (!problems.isEmpty()) {
            throw new InvalidRealmException(String.join("; ", problems));
        }
        realm.setAllowedIpRanges(ranges);
        log.info("Updated IP whitelist of realm {} to {}", realmId, ranges);
        return realm;
    }

    /**
     * Deletes the realm together with all of its tokens.
     */
    @Transactional
    public void deleteRealm(UUID realmId) {
        Realm realm = find(realmId);
        int tokens = tokenRepository.deleteAllByRealmId(realmId);
        realmRepository.delete(realm);
        log.info("Deleted realm {} and {} token(s)", realmId, tokens);
    }

    private Realm find(UUID realmId) {
        return realmRepository.findById(realmId)
                .orElseThrow(() -> new RealmNotFoundException("Realm not found: " + realmId));
    }

    private static List<String> trimmed(List<String> entries) {
        List<String> result = new ArrayList<>();
        if (entries != null) {
            for (String entry : entries) {
                if (entry != null && !entry.isBlank()) {
                    result.add(entry.trim());
                }
            }
        }
        return result;
    }

    /**
     * Empty record types or operations grant all of them.
     */
    public record CreateRealmCommand(
            UUID accountId,
            RealmType realmType,
            String realmValue,
            List<String> recordTypes,
            Set<DnsOperation> operations,
            List<String> allowedIpRanges,
            boolean allowBroadRanges) {
    }

    public static class InvalidRealmException extends RuntimeException {
        public InvalidRealmException(String message) { super(message); }
    }

    public static class DuplicateRealmException extends RuntimeException {
        public DuplicateRealmException(String message) { super(message); }
    }

    public static class RealmNotFoundException extends RuntimeException {
        public RealmNotFoundException(String message) { super(message); }
    }
}
