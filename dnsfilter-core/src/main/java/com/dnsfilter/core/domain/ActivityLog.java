package com.dnsfilter.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable audit entry, one per request attempt.
 *
 * Account, realm and token references are nullable because many failures
 * happen before any of them is resolved. No setters: entries are built once
 * through {@link Builder} and never updated.
 */
@Entity
@Table(name = "activity_log", indexes = {
    @Index(name = "idx_activity_account", columnList = "account_id"),
    @Index(name = "idx_activity_token", columnList = "token_id"),
    @Index(name = "idx_activity_created", columnList = "created_at"),
    @Index(name = "idx_activity_source_ip", columnList = "source_ip"),
    @Index(name = "idx_activity_error_code", columnList = "error_code")
})
public class ActivityLog {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Column(name = "realm_id", updatable = false)
    private UUID realmId;

    @Column(name = "token_id", updatable = false)
    private UUID tokenId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 30, updatable = false)
    private ActivityType activityType;

    @Column(name = "surface", length = 20, updatable = false)
    private String surface;

    @NotNull
    @Column(name = "source_ip", nullable = false, length = 45, updatable = false)
    private String sourceIp;

    @Column(name = "user_agent", length = 500, updatable = false)
    private String userAgent;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20, updatable = false)
    private Status status;

    @Column(name = "error_code", length = 40, updatable = false)
    private String errorCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 10, updatable = false)
    private Severity severity;

    @Column(name = "is_attack", nullable = false, updatable = false)
    private boolean attack;

    @Column(name = "domain", updatable = false)
    private String domain;

    @Column(name = "record_name", updatable = false)
    private String recordName;

    @Convert(converter = StringListConverter.class)
    @Column(name = "record_types", length = 200, updatable = false)
    private List<String> recordTypes;

    @Column(name = "operation", length = 20, updatable = false)
    private String operation;

    @Column(name = "decision", length = 40, updatable = false)
    private String decision;

    @Column(name = "status_reason", length = 1000, updatable = false)
    private String statusReason;

    @Column(name = "token_fingerprint", length = 40, updatable = false)
    private String tokenFingerprint;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum ActivityType {
        DNS_READ,
        DNS_UPDATE,
        FAILED_AUTH,
        SECURITY_EVENT
    }

    public enum Status {
        SUCCESS,
        FAILURE,
        ERROR
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        public boolean indicatesAttack() {
            return this == HIGH || this == CRITICAL;
        }
    }

    protected ActivityLog() {}

    public static Builder builder(ActivityType activityType, Status status, String sourceIp) {
        return new Builder(activityType, status, sourceIp);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getAccountId() { return accountId; }
    public UUID getRealmId() { return realmId; }
    public UUID getTokenId() { return tokenId; }
    public ActivityType getActivityType() { return activityType; }
    public String getSurface() { return surface; }
    public String getSourceIp() { return sourceIp; }
    public String getUserAgent() { return userAgent; }
    public Status getStatus() { return status; }
    public String getErrorCode() { return errorCode; }
    public Severity getSeverity() { return severity; }
    public boolean isAttack() { return attack; }
    public String getDomain() { return domain; }
    public String getRecordName() { return recordName; }
    public List<String> getRecordTypes() { return recordTypes == null ? List.of() : List.copyOf(recordTypes); }
    public String getOperation() { return operation; }
    public String getDecision() { return decision; }
    public String getStatusReason() { return statusReason; }
    public String getTokenFingerprint() { return tokenFingerprint; }
    public Instant getCreatedAt() { return createdAt; }

    public static final class Builder {
        private final ActivityLog entry = new ActivityLog();

        private Builder(ActivityType activityType, Status status, String sourceIp) {
            if (activityType == null || status == null) {
                throw new IllegalArgumentException("Activity type and status are required");
            }
            entry.id = UUID.randomUUID();
            entry.activityType = activityType;
            entry.status = status;
            entry.sourceIp = sourceIp == null || sourceIp.isBlank() ? "unknown" : sourceIp;
        }

        public Builder account(UUID accountId) { entry.accountId = accountId; return this; }
        public Builder realm(UUID realmId) { entry.realmId = realmId; return this; }
        public Builder token(UUID tokenId) { entry.tokenId = tokenId; return this; }
        public Builder surface(String surface) { entry.surface = surface; return this; }
        public Builder userAgent(String userAgent) { entry.userAgent = userAgent; return this; }
        public Builder errorCode(String errorCode) { entry.errorCode = errorCode; return this; }
        public Builder severity(Severity severity) { entry.severity = severity; return this; }
        public Builder domain(String domain) { entry.domain = domain; return this; }
        public Builder recordName(String recordName) { entry.recordName = recordName; return this; }
        public Builder recordTypes(List<String> recordTypes) {
            entry.recordTypes = recordTypes == null ? List.of() : List.copyOf(recordTypes);
            return this;
        }
        public Builder operation(String operation) { entry.operation = operation; return this; }
        public Builder decision(String decision) { entry.decision = decision; return this; }
        public Builder statusReason(String statusReason) { entry.statusReason = statusReason; return this; }
        public Builder tokenFingerprint(String fingerprint) { entry.tokenFingerprint = fingerprint; return this; }

        public ActivityLog build() {
            entry.attack = entry.severity != null && entry.severity.indicatesAttack();
            entry.createdAt = Instant.now();
            return entry;
        }
    }
}
