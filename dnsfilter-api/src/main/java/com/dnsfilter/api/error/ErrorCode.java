package com.dnsfilter.api.error;

import com.dnsfilter.core.domain.ActivityLog.Severity;
import com.dnsfilter.core.domain.ActivityLog.Status;

/**
 * Machine-readable failure codes.
 *
 * The internal code is what the audit log records; the public code is what a
 * JSON client sees. All authentication failures share one public code so a
 * caller cannot tell an unknown token from a wrong secret.
 */
public enum ErrorCode {
    MISSING_TOKEN("missing_token", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.LOW),
    INVALID_FORMAT("invalid_format", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.LOW),
    TOKEN_NOT_FOUND("token_not_found", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.HIGH),
    TOKEN_HASH_MISMATCH("token_hash_mismatch", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.CRITICAL),
    TOKEN_REVOKED("token_revoked", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.HIGH),
    TOKEN_EXPIRED("token_expired", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.LOW),
    ACCOUNT_DISABLED("account_disabled", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.MEDIUM),
    ORPHANED_TOKEN("orphaned_token", "unauthorized", ErrorCategory.AUTHENTICATION, Severity.HIGH),

    IP_DENIED("ip_denied", "ip_not_allowed", ErrorCategory.AUTHORIZATION, Severity.CRITICAL),
    IP_WHITELIST_MISCONFIGURED("ip_whitelist_misconfigured", "ip_not_allowed", ErrorCategory.AUTHORIZATION, Severity.HIGH),
    DOMAIN_DENIED("domain_denied", "out_of_scope", ErrorCategory.AUTHORIZATION, Severity.HIGH),
    NO_DOMAIN_ROOT("no_domain_root", "out_of_scope", ErrorCategory.AUTHORIZATION, Severity.MEDIUM),
    APEX_DENIED("apex_denied", "apex_denied", ErrorCategory.AUTHORIZATION, Severity.MEDIUM),
    DEPTH_OUT_OF_RANGE("depth_out_of_range", "depth_out_of_range", ErrorCategory.AUTHORIZATION, Severity.MEDIUM),
    OPERATION_DENIED("operation_denied", "operation_not_allowed", ErrorCategory.AUTHORIZATION, Severity.MEDIUM),
    RECORD_TYPE_DENIED("record_type_denied", "record_type_not_allowed", ErrorCategory.AUTHORIZATION, Severity.LOW),

    MISSING_PARAMETER("missing_parameter", "missing_parameter", ErrorCategory.VALIDATION, Severity.LOW),
    INVALID_HOSTNAME("invalid_hostname", "invalid_hostname", ErrorCategory.VALIDATION, Severity.LOW),
    INVALID_IP("invalid_ip", "invalid_ip", ErrorCategory.VALIDATION, Severity.LOW),
    INVALID_RECORD("invalid_record", "invalid_record", ErrorCategory.VALIDATION, Severity.LOW),
    INVALID_REQUEST("invalid_request", "invalid_request", ErrorCategory.VALIDATION, Severity.LOW),

    BACKEND_ERROR("backend_error", "backend_error", ErrorCategory.BACKEND, Severity.MEDIUM),
    BACKEND_UNAVAILABLE("backend_unavailable", "backend_error", ErrorCategory.BACKEND, Severity.HIGH),

    RATE_LIMITED("rate_limited", "rate_limited", ErrorCategory.RATE_LIMITED, Severity.MEDIUM),
    SERVICE_DISABLED("service_disabled", "service_disabled", ErrorCategory.DISABLED, Severity.LOW),
    INTERNAL_ERROR("internal_error", "internal_error", ErrorCategory.INTERNAL, Severity.CRITICAL);

    private final String code;
    private final String publicCode;
    private final ErrorCategory category;
    private final Severity severity;

    ErrorCode(String code, String publicCode, ErrorCategory category, Severity severity) {
        this.code = code;
        this.publicCode = publicCode;
        this.category = category;
        this.severity = severity;
    }

    public String code() {
        return code;
    }

    public String publicCode() {
        return publicCode;
    }

    public ErrorCategory category() {
        return category;
    }

    /**
     * Default severity recorded in the audit log.
     */
    public Severity severity() {
        return severity;
    }

    public Status auditStatus() {
        // misconfiguration is recorded as ERROR
        return this == IP_WHITELIST_MISCONFIGURED ? Status.ERROR : category.auditStatus();
    }
}
