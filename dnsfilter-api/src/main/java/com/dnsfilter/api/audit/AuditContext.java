package com.dnsfilter.api.audit;

import java.util.List;
import java.util.UUID;

/**
 * Request facts attached to an audit entry. Any field may be null when the
 * request failed before it was known. Never holds a raw token.
 */
public record AuditContext(
        String surface,
        String sourceIp,
        String userAgent,
        UUID accountId,
        UUID realmId,
        UUID tokenId,
        String tokenPrefix,
        String tokenFingerprint,
        String domain,
        String recordName,
        List<String> recordTypes,
        String operation,
        String decision,
        String statusReason) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String surface;
        private String sourceIp;
        private String userAgent;
        private UUID accountId;
        private UUID realmId;
        private UUID tokenId;
        private String tokenPrefix;
        private String tokenFingerprint;
        private String domain;
        private String recordName;
        private List<String> recordTypes = List.of();
        private String operation;
        private String decision;
        private String statusReason;

        private Builder() {}

        public Builder surface(String surface) { this.surface = surface; return this; }
        public Builder sourceIp(String sourceIp) { this.sourceIp = sourceIp; return this; }
        public Builder userAgent(String userAgent) { this.userAgent = userAgent; return this; }
        public Builder accountId(UUID accountId) { this.accountId = accountId; return this; }
        public Builder realmId(UUID realmId) { this.realmId = realmId; return this; }
        public Builder tokenId(UUID tokenId) { this.tokenId = tokenId; return this; }
        public Builder tokenPrefix(String tokenPrefix) { this.tokenPrefix = tokenPrefix; return this; }
        public Builder tokenFingerprint(String fingerprint) { this.tokenFingerprint = fingerprint; return this; }
        public Builder domain(String domain) { this.domain = domain; return this; }
        public Builder recordName(String recordName) { this.recordName = recordName; return this; }
        public Builder recordTypes(List<String> recordTypes) {
            this.recordTypes = recordTypes == null ? List.of() : List.copyOf(recordTypes);
            return this;
        }
        public Builder operation(String operation) { this.operation = operation; return this; }
        public Builder decision(String decision) { this.decision = decision; return this; }
        public Builder statusReason(String statusReason) { this.statusReason = statusReason; return this; }

        public AuditContext build() {
            return new AuditContext(surface, sourceIp, userAgent, accountId, realmId, tokenId, tokenPrefix,
                    tokenFingerprint, domain, recordName, recordTypes, operation, decision, statusReason);
        }
    }
}
