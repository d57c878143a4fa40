package com.dnsfilter.api.audit;

import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.core.domain.ActivityLog;
import com.dnsfilter.core.domain.ActivityLog.ActivityType;
import com.dnsfilter.core.domain.ActivityLog.Severity;
import com.dnsfilter.core.domain.ActivityLog.Status;
import com.dnsfilter.core.repository.ActivityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only activity log writer.
 *
 * Each entry is stored in its own transaction so it survives a rollback of
 * the surrounding work, then mirrored to the {@code AUDIT} logger. Write
 * failures are escalated, never dropped.
 */
@Service
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Logger auditLog = LoggerFactory.getLogger("AUDIT");

    private final ActivityLogRepository activityLogRepository;

    public AuditLogger(ActivityLogRepository activityLogRepository) {
        this.activityLogRepository = activityLogRepository;
    }

    /**
     * @param errorCode null for successful requests
     * @param severity  null to use the error code's default
     * @throws AuditWriteException when the entry could not be stored
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ActivityLog record(
            ActivityType activityType,
            Status status,
            ErrorCode errorCode,
            Severity severity,
            AuditContext context) {

        Severity effectiveSeverity = severity != null ? severity
                : errorCode != null ? errorCode.severity() : null;

        ActivityLog entry = ActivityLog.builder(activityType, status, context.sourceIp())
                .surface(context.surface())
                .userAgent(truncate(context.userAgent(), 500))
                .account(context.accountId())
                .realm(context.realmId())
                .token(context.tokenId())
                .tokenFingerprint(context.tokenFingerprint())
                .errorCode(errorCode == null ? null : errorCode.code())
                .severity(effectiveSeverity)
                .domain(context.domain())
                .recordName(context.recordName())
                .recordTypes(context.recordTypes())
                .operation(context.operation())
                .decision(context.decision())
                .statusReason(truncate(context.statusReason(), 1000))
                .build();

        try {
            ActivityLog saved = activityLogRepository.saveAndFlush(entry);
            mirror(saved, context);
            return saved;
        } catch (DataAccessException e) {
            log.error("Audit write failed for {} {} from {}", activityType, status, entry.getSourceIp(), e);
            throw new AuditWriteException("Audit entry could not be stored", e);
        }
    }

    private void mirror(ActivityLog entry, AuditContext context) {
        String line = "type={} status={} code={} severity={} attack={} surface={} ip={} account={} realm={} "
                + "token={} prefix={} fp={} domain={} op={} types={} decision={} reason={}";
        Object[] args = {
                entry.getActivityType(), entry.getStatus(), entry.getErrorCode(), entry.getSeverity(),
                entry.isAttack(), entry.getSurface(), entry.getSourceIp(), entry.getAccountId(),
                entry.getRealmId(), entry.getTokenId(), context.tokenPrefix(), entry.getTokenFingerprint(),
                entry.getDomain(), entry.getOperation(), entry.getRecordTypes(), entry.getDecision(),
                entry.getStatusReason()
        };
        if (entry.getStatus() == Status.SUCCESS) {
            auditLog.info(line, args);
        } else {
            auditLog.warn(line, args);
        }
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
