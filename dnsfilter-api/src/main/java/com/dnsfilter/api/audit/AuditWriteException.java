package com.dnsfilter.api.audit;

/**
 * An audit entry could not be persisted. The request it belongs to must not
 * be reported as successful.
 */
public class AuditWriteException extends RuntimeException {

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
