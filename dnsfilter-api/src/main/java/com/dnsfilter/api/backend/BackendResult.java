package com.dnsfilter.api.backend;

import java.util.List;

/**
 * Result of applying changes. {@code changed} is false when every change was
 * already in effect. {@code error} is backend detail for logs only.
 */
public record BackendResult(boolean ok, boolean changed, List<DnsRecord> records, String error) {

    public static BackendResult success(boolean changed, List<DnsRecord> records) {
        return new BackendResult(true, changed, List.copyOf(records), null);
    }

    public static BackendResult failure(String error) {
        return new BackendResult(false, false, List.of(), error);
    }
}
