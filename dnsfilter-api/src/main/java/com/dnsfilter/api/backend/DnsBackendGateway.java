package com.dnsfilter.api.backend;

import java.util.List;

/**
 * Client for a DNS provider holding one or more zones.
 *
 * Implementations report provider failures through the result types and
 * should not throw for them.
 */
public interface DnsBackendGateway {

    /**
     * Name a managed domain root uses to select this backend.
     */
    String name();

    BackendResult apply(String zone, List<RecordChange> changes);

    BackendListing listRecords(String zone);
}
