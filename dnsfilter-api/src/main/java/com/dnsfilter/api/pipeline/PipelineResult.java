package com.dnsfilter.api.pipeline;

import com.dnsfilter.api.authz.Decision;
import com.dnsfilter.api.backend.DnsRecord;
import com.dnsfilter.api.error.ErrorCode;

import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * {@code errorCode} is null exactly when the request succeeded.
 * {@code detail} is internal and goes to the audit log only.
 */
public record PipelineResult(
        ErrorCode errorCode,
        Decision decision,
        boolean changed,
        List<DnsRecord> records,
        String detail) {

    public static PipelineResult success(Decision decision, boolean changed, List<DnsRecord> records) {
        return new PipelineResult(null, decision, changed, List.copyOf(records), null);
    }

    public static PipelineResult failure(ErrorCode errorCode, String detail) {
        return new PipelineResult(errorCode, null, false, List.of(), detail);
    }

    public static PipelineResult denied(ErrorCode errorCode, Decision decision, String detail) {
        return new PipelineResult(errorCode, decision, false, List.of(), detail);
    }

    public boolean isSuccess() {
        return errorCode == null;
    }

    public int httpStatus() {
        return errorCode == null ? 200 : errorCode.category().httpStatus();
    }
}
