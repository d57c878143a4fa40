package com.dnsfilter.api.ddns;

/**
 * Protocol-level outcome classes, one row each in the response table.
 */
public enum DdnsCondition {
    UPDATED(200),
    UNCHANGED(200),
    AUTH_FAILED(401),
    NOT_YOURS(403),
    MALFORMED(400),
    DNS_ERROR(502),
    INTERNAL_FAULT(500),
    ABUSE(429),
    DISABLED(503);

    private final int httpStatus;

    DdnsCondition(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
