package com.dnsfilter.api.pipeline;

import com.dnsfilter.api.backend.RecordChange;
import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.core.domain.DnsOperation;

import java.util.List;

/**
 * A surface-neutral DNS request.
 *
 * Surfaces parse their own parameters; a parse failure is carried in
 * {@code validationError} and reported only after the caller authenticated,
 * so an anonymous caller never learns which inputs were acceptable.
 * {@code targetDomain} is normalized whenever {@code validationError} is null.
 */
public record DnsRequest(
        Surface surface,
        String presentedToken,
        String sourceIp,
        String userAgent,
        String targetDomain,
        DnsOperation operation,
        List<String> recordTypes,
        List<RecordChange> changes,
        ErrorCode validationError,
        String validationDetail) {

    public DnsRequest {
        if (surface == null || operation == null) {
            throw new IllegalArgumentException("Surface and operation are required");
        }
        recordTypes = recordTypes == null ? List.of() : List.copyOf(recordTypes);
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static DnsRequest read(Surface surface, String token, String sourceIp, String userAgent, String targetDomain) {
        return new DnsRequest(surface, token, sourceIp, userAgent, targetDomain, DnsOperation.READ,
                List.of(), List.of(), null, null);
    }

    public static DnsRequest change(Surface surface, String token, String sourceIp, String userAgent,
                                    String targetDomain, RecordChange change) {
        return new DnsRequest(surface, token, sourceIp, userAgent, targetDomain, change.operation(),
                List.of(change.record().type()), List.of(change), null, null);
    }

    public static DnsRequest invalid(Surface surface, String token, String sourceIp, String userAgent,
                                     String rawTarget, DnsOperation operation, ErrorCode error, String detail) {
        return new DnsRequest(surface, token, sourceIp, userAgent, rawTarget, operation,
                List.of(), List.of(), error, detail);
    }

    public boolean isValid() {
        return validationError == null;
    }
}
