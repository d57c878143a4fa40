package com.dnsfilter.api.backend;

import com.dnsfilter.core.domain.DnsOperation;

/**
 * One requested modification.
 *
 * UPDATE without a record id is an upsert keyed by name and type, the form
 * dynamic DNS clients use. UPDATE and DELETE with an id must refer to a
 * record with the same name and type.
 */
public record RecordChange(DnsOperation operation, DnsRecord record) {

    public RecordChange {
        if (operation == null || operation == DnsOperation.READ) {
            throw new IllegalArgumentException("Record change requires a mutating operation");
        }
        if (record == null) {
            throw new IllegalArgumentException("Record is required");
        }
    }

    public static RecordChange upsert(String name, String type, String destination) {
        return new RecordChange(DnsOperation.UPDATE, new DnsRecord(null, name, type, destination, null));
    }
}
