package com.dnsfilter.api.authz;

import com.dnsfilter.core.domain.AuthToken;
import com.dnsfilter.core.domain.DnsOperation;
import com.dnsfilter.core.domain.Realm;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * Decides whether a realm may perform an operation on a target name.
 *
 * Checks run in a fixed order and the first failure wins:
 * realm scope, domain-root apex, domain-root depth, operation, record type.
 * Operation and record type restrictions from the realm, the presented token
 * and the domain root all apply, so the effective grant is their
 * intersection. Pure function of its arguments.
 */
@Component
public class RealmAuthorizationEngine {

    /**
     * @param token the presented token, or null to evaluate the realm's grant alone
     */
    public Decision authorize(
            Realm realm,
            AuthToken token,
            String targetDomain,
            Collection<String> requestedRecordTypes,
            DnsOperation operation,
            DomainRootPolicy policy) {

        Optional<String> target = DomainName.normalize(targetDomain);
        if (target.isEmpty() || !isInRealmScope(realm, target.get()) || policy == null) {
            return Decision.deny(DenialReason.OUT_OF_SCOPE);
        }

        int depth = DomainName.depthBelow(target.get(), policy.rootDomain());
        if (depth < 0) {
            return Decision.deny(DenialReason.OUT_OF_SCOPE);
        }
        if (depth == 0) {
            if (!policy.allowApexAccess()) {
                return Decision.deny(DenialReason.APEX_DENIED);
            }
        } else if (depth < policy.minSubdomainDepth() || depth > policy.maxSubdomainDepth()) {
            return Decision.deny(DenialReason.DEPTH_OUT_OF_RANGE);
        }

        if (!isOperationAllowed(realm, token, policy, operation)) {
            return Decision.deny(DenialReason.OPERATION_NOT_ALLOWED);
        }

        if (requestedRecordTypes != null) {
            for (String recordType : requestedRecordTypes) {
                if (!isRecordTypeAllowed(realm, token, policy, recordType)) {
                    return Decision.deny(DenialReason.RECORD_TYPE_NOT_ALLOWED);
                }
            }
        }
        return Decision.allow();
    }

    /**
     * Realm pattern match only, domain-root policy not consulted.
     */
    public boolean isInRealmScope(Realm realm, String targetDomain) {
        Optional<String> target = DomainName.normalize(targetDomain);
        Optional<String> realmValue = DomainName.normalize(realm.getRealmValue());
        if (target.isEmpty() || realmValue.isEmpty()) {
            return false;
        }
        return switch (realm.getRealmType()) {
            case HOST -> target.get().equals(realmValue.get());
            case SUBDOMAIN -> DomainName.isSameOrBelow(target.get(), realmValue.get());
            case WILDCARD -> DomainName.isStrictlyBelow(target.get(), realmValue.get());
        };
    }

    /**
     * Record type symbols compare exactly; {@code a} is not {@code A}.
     */
    private boolean isRecordTypeAllowed(Realm realm, AuthToken token, DomainRootPolicy policy, String recordType) {
        if (recordType == null) {
            return false;
        }
        if (realm.restrictsRecordTypes() && !realm.getRecordTypes().contains(recordType)) {
            return false;
        }
        if (token != null && token.restrictsRecordTypes() && !token.getAllowedRecordTypes().contains(recordType)) {
            return false;
        }
        return policy.allowedRecordTypes().isEmpty() || policy.allowedRecordTypes().contains(recordType);
    }

    private boolean isOperationAllowed(Realm realm, AuthToken token, DomainRootPolicy policy, DnsOperation operation) {
        if (operation == null) {
            return false;
        }
        if (realm.restrictsOperations() && !realm.getOperationSet().contains(operation)) {
            return false;
        }
        if (token != null && token.restrictsOperations() && !token.getOperationSet().contains(operation)) {
            return false;
        }
        return policy.allowedOperations().isEmpty() || policy.allowedOperations().contains(operation);
    }
}
