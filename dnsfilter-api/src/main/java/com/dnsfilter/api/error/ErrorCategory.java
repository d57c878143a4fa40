package com.dnsfilter.api.error;

import com.dnsfilter.core.domain.ActivityLog.ActivityType;
import com.dnsfilter.core.domain.ActivityLog.Status;
import com.dnsfilter.core.domain.DnsOperation;

/**
 * Failure families shared by every request surface.
 * Each category fixes the HTTP status and how the audit entry is classified.
 */
public enum ErrorCategory {
    AUTHENTICATION(401, Status.FAILURE),
    AUTHORIZATION(403, Status.FAILURE),
    VALIDATION(400, Status.FAILURE),
    BACKEND(502, Status.ERROR),
    INTERNAL(500, Status.ERROR),
    RATE_LIMITED(429, Status.FAILURE),
    DISABLED(503, Status.FAILURE);

    private final int httpStatus;
    private final Status auditStatus;

    ErrorCategory(int httpStatus, Status auditStatus) {
        this.httpStatus = httpStatus;
        this.auditStatus = auditStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public Status auditStatus() {
        return auditStatus;
    }

    public ActivityType activityType(DnsOperation operation) {
        return switch (this) {
            case AUTHENTICATION -> ActivityType.FAILED_AUTH;
            case AUTHORIZATION, RATE_LIMITED -> ActivityType.SECURITY_EVENT;
            default -> operation == DnsOperation.READ ? ActivityType.DNS_READ : ActivityType.DNS_UPDATE;
        };
    }
}
