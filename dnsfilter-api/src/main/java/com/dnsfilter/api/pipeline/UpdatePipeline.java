package com.dnsfilter.api.pipeline;

import com.dnsfilter.api.audit.AuditContext;
import com.dnsfilter.api.audit.AuditLogger;
import com.dnsfilter.api.audit.AuditWriteException;
import com.dnsfilter.api.auth.AuthResult;
import com.dnsfilter.api.auth.TokenAuthenticator;
import com.dnsfilter.api.authz.Decision;
import com.dnsfilter.api.authz.DenialReason;
import com.dnsfilter.api.authz.DomainName;
import com.dnsfilter.api.authz.DomainRootPolicy;
import com.dnsfilter.api.authz.DomainRootPolicyService;
import com.dnsfilter.api.authz.RealmAuthorizationEngine;
import com.dnsfilter.api.backend.BackendListing;
import com.dnsfilter.api.backend.BackendResult;
import com.dnsfilter.api.backend.DnsBackendGateway;
import com.dnsfilter.api.backend.DnsBackendRegistry;
import com.dnsfilter.api.backend.DnsRecord;
import com.dnsfilter.api.backend.RecordChange;
import com.dnsfilter.api.config.RateLimiter;
import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.api.ip.IpWhitelistValidator;
import com.dnsfilter.api.ip.WhitelistVerdict;
import com.dnsfilter.core.domain.ActivityLog.ActivityType;
import com.dnsfilter.core.domain.ActivityLog.Status;
import com.dnsfilter.core.domain.AuthToken;
import com.dnsfilter.core.domain.DnsOperation;
import com.dnsfilter.core.domain.Realm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;

/**
 * Runs one DNS request through every check and writes its audit entry.
 *
 * Stages, in order: rate limit, authentication, input validation, IP
 * whitelist, realm scope, domain root lookup, authorization, backend call.
 * A stage rejects by returning a result, never by throwing. Unexpected
 * exceptions become an internal error. Exactly one audit entry is written
 * per call, after the outcome is known.
 */
@Service
public class UpdatePipeline {

    private static final Logger log = LoggerFactory.getLogger(UpdatePipeline.class);

    private final RateLimiter rateLimiter;
    private final TokenAuthenticator authenticator;
    private final IpWhitelistValidator ipWhitelistValidator;
    private final DomainRootPolicyService policyService;
    private final RealmAuthorizationEngine authorizationEngine;
    private final DnsBackendRegistry backendRegistry;
    private final AuditLogger auditLogger;

    public UpdatePipeline(
            RateLimiter rateLimiter,
            TokenAuthenticator authenticator,
            IpWhitelistValidator ipWhitelistValidator,
            DomainRootPolicyService policyService,
            RealmAuthorizationEngine authorizationEngine,
            DnsBackendRegistry backendRegistry,
            AuditLogger auditLogger) {
        this.rateLimiter = rateLimiter;
        this.authenticator = authenticator;
        this.ipWhitelistValidator = ipWhitelistValidator;
        this.policyService = policyService;
        this.authorizationEngine = authorizationEngine;
        this.backendRegistry = backendRegistry;
        this.auditLogger = auditLogger;
    }

    /**
     * @throws AuditWriteException when the audit entry cannot be stored
     */
    public PipelineResult process(DnsRequest request) {
        AuditContext.Builder audit = baseContext(request);
        PipelineResult result;
        try {
            result = evaluate(request, audit);
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {} {} request for {}",
                    request.surface().symbol(), request.operation().symbol(), request.targetDomain(), e);
            result = PipelineResult.failure(ErrorCode.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        record(request, result, audit);
        return result;
    }

    /**
     * Rejects a request without evaluating it, still producing its audit entry.
     */
    public PipelineResult reject(DnsRequest request, ErrorCode errorCode, String detail) {
        PipelineResult result = PipelineResult.failure(errorCode, detail);
        record(request, result, baseContext(request));
        return result;
    }

    private PipelineResult evaluate(DnsRequest request, AuditContext.Builder audit) {
        String limiterKey = request.surface().symbol() + ":" + request.sourceIp();
        if (!rateLimiter.tryAcquire(limiterKey)) {
            log.warn("Rate limit exceeded for {} on {}", request.sourceIp(), request.surface().symbol());
            return PipelineResult.failure(ErrorCode.RATE_LIMITED, "rate limit exceeded");
        }

        AuthResult auth = authenticator.authenticate(request.presentedToken(), request.sourceIp());
        attribute(audit, auth);
        if (!auth.isAuthenticated()) {
            String prefix = auth.tokenPrefix() == null ? "" : " prefix=" + auth.tokenPrefix();
            return PipelineResult.failure(auth.errorCode(), "authentication failed: " + auth.failure() + prefix);
        }

        if (!request.isValid()) {
            return PipelineResult.failure(request.validationError(), request.validationDetail());
        }

        Realm realm = auth.realm();
        AuthToken token = auth.token();
        // realm ranges first, then the token's own ranges; both must admit the source
        for (List<String> ranges : List.of(realm.getAllowedIpRanges(), token.getAllowedIpRanges())) {
            WhitelistVerdict verdict = ipWhitelistValidator.isIpAllowed(ranges, request.sourceIp());
            if (verdict.isMisconfigured()) {
                return PipelineResult.failure(ErrorCode.IP_WHITELIST_MISCONFIGURED,
                        verdict.detail() + ": " + verdict.misconfiguredEntry());
            }
            if (!verdict.allowed()) {
                return PipelineResult.failure(ErrorCode.IP_DENIED, verdict.detail());
            }
        }

        String target = request.targetDomain();
        Decision outOfScope = Decision.deny(DenialReason.OUT_OF_SCOPE);
        if (!authorizationEngine.isInRealmScope(realm, target)) {
            audit.decision(outOfScope.label());
            return PipelineResult.denied(ErrorCode.DOMAIN_DENIED, outOfScope, target + " outside " + realm);
        }
        Optional<DomainRootPolicy> policy = policyService.policyFor(target);
        if (policy.isEmpty()) {
            audit.decision(outOfScope.label());
            return PipelineResult.denied(ErrorCode.NO_DOMAIN_ROOT, outOfScope, "no managed domain root for " + target);
        }

        for (RecordChange change : request.changes()) {
            if (!target.equals(change.record().name())) {
                return PipelineResult.failure(ErrorCode.INVALID_RECORD,
                        "change for " + change.record().name() + " does not match " + target);
            }
        }

        Decision decision = authorizationEngine.authorize(
                realm, token, target, request.recordTypes(), request.operation(), policy.get());
        audit.decision(decision.label());
        if (decision instanceof Decision.Deny deny) {
            return PipelineResult.denied(deny.reason().errorCode(), decision,
                    request.operation().symbol() + " " + request.recordTypes() + " on " + target + " denied for " + realm);
        }

        Optional<DnsBackendGateway> gateway = backendRegistry.forBackend(policy.get().backendName());
        if (gateway.isEmpty()) {
            log.error("Domain root {} references unknown backend '{}'",
                    policy.get().rootDomain(), policy.get().backendName());
            return PipelineResult.failure(ErrorCode.BACKEND_UNAVAILABLE, "unknown backend " + policy.get().backendName());
        }

        return request.operation() == DnsOperation.READ
                ? read(realm, token, target, policy.get(), gateway.get(), decision)
                : write(request, policy.get(), gateway.get(), decision);
    }

    private PipelineResult read(Realm realm, AuthToken token, String target, DomainRootPolicy policy,
                                DnsBackendGateway gateway, Decision decision) {
        BackendListing listing;
        try {
            listing = gateway.listRecords(policy.rootDomain());
        } catch (RuntimeException e) {
            log.error("Backend {} failed listing zone {}", gateway.name(), policy.rootDomain(), e);
            return PipelineResult.failure(ErrorCode.BACKEND_ERROR, e.getMessage());
        }
        if (!listing.ok()) {
            log.warn("Backend {} rejected listing zone {}: {}", gateway.name(), policy.rootDomain(), listing.error());
            return PipelineResult.failure(ErrorCode.BACKEND_ERROR, listing.error());
        }

        List<DnsRecord> visible = listing.records().stream()
                .filter(record -> isVisible(realm, token, target, policy, record))
                .toList();
        return PipelineResult.success(decision, false, visible);
    }

    private boolean isVisible(Realm realm, AuthToken token, String target, DomainRootPolicy policy, DnsRecord record) {
        Optional<String> name = DomainName.normalize(record.name());
        return name.isPresent()
                && DomainName.isSameOrBelow(name.get(), target)
                && authorizationEngine.authorize(realm, token, name.get(), List.of(record.type()), DnsOperation.READ, policy)
                        .isAllowed();
    }

    private PipelineResult write(DnsRequest request, DomainRootPolicy policy,
                                 DnsBackendGateway gateway, Decision decision) {
        BackendResult result;
        try {
            result = gateway.apply(policy.rootDomain(), request.changes());
        } catch (RuntimeException e) {
            log.error("Backend {} failed applying changes to zone {}", gateway.name(), policy.rootDomain(), e);
            return PipelineResult.failure(ErrorCode.BACKEND_ERROR, e.getMessage());
        }
        if (!result.ok()) {
            log.warn("Backend {} rejected changes to zone {}: {}", gateway.name(), policy.rootDomain(), result.error());
            return PipelineResult.failure(ErrorCode.BACKEND_ERROR, result.error());
        }
        return PipelineResult.success(decision, result.changed(), result.records());
    }

    private AuditContext.Builder baseContext(DnsRequest request) {
        String recordName = request.changes().isEmpty() ? null : request.changes().get(0).record().name();
        return AuditContext.builder()
                .surface(request.surface().symbol())
                .sourceIp(request.sourceIp())
                .userAgent(request.userAgent())
                .domain(request.targetDomain())
                .recordName(recordName)
                .recordTypes(request.recordTypes())
                .operation(request.operation().symbol());
    }

    private static void attribute(AuditContext.Builder audit, AuthResult auth) {
        audit.tokenPrefix(auth.tokenPrefix())
                .tokenFingerprint(auth.tokenFingerprint());
        if (auth.token() != null) {
            audit.tokenId(auth.token().getId());
        }
        if (auth.realm() != null) {
            audit.realmId(auth.realm().getId());
        }
        if (auth.account() != null) {
            audit.accountId(auth.account().getId());
        }
    }

    private void record(DnsRequest request, PipelineResult result, AuditContext.Builder audit) {
        ActivityType activityType;
        Status status;
        if (result.isSuccess()) {
            activityType = request.operation() == DnsOperation.READ ? ActivityType.DNS_READ : ActivityType.DNS_UPDATE;
            status = Status.SUCCESS;
        } else {
            activityType = result.errorCode().category().activityType(request.operation());
            status = result.errorCode().auditStatus();
        }
        audit.statusReason(result.detail());
        try {
            auditLogger.record(activityType, status, result.errorCode(), null, audit.build());
        } catch (TransactionException e) {
            // raised by the audit transaction itself, outside AuditLogger's own handling
            log.error("Audit transaction failed for {} {} from {}", activityType, status, request.sourceIp(), e);
            throw new AuditWriteException("Audit entry could not be stored", e);
        }
    }
}
