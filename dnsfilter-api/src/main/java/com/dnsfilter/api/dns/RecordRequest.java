package com.dnsfilter.api.dns;

/**
 * Body of a create or update call. Validated after authentication.
 */
public record RecordRequest(String type, String destination, Integer ttl) {
}
