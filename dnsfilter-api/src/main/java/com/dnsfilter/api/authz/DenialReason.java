package com.dnsfilter.api.authz;

import com.dnsfilter.api.error.ErrorCode;

public enum DenialReason {
    OUT_OF_SCOPE(ErrorCode.DOMAIN_DENIED),
    RECORD_TYPE_NOT_ALLOWED(ErrorCode.RECORD_TYPE_DENIED),
    OPERATION_NOT_ALLOWED(ErrorCode.OPERATION_DENIED),
    APEX_DENIED(ErrorCode.APEX_DENIED),
    DEPTH_OUT_OF_RANGE(ErrorCode.DEPTH_OUT_OF_RANGE);

    private final ErrorCode errorCode;

    DenialReason(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
