package com.dnsfilter.api.backend;

import java.util.List;

public record BackendListing(boolean ok, List<DnsRecord> records, String error) {

    public static BackendListing of(List<DnsRecord> records) {
        return new BackendListing(true, List.copyOf(records), null);
    }

    public static BackendListing failure(String error) {
        return new BackendListing(false, List.of(), error);
    }
}
