package com.dnsfilter.api.backend;

/**
 * A DNS record as seen by a backend. {@code name} is the fully qualified,
 * normalized owner name; {@code id} is null for records not yet stored.
 */
public record DnsRecord(String id, String name, String type, String destination, Integer ttl) {

    public DnsRecord withId(String newId) {
        return new DnsRecord(newId, name, type, destination, ttl);
    }
}
