package com.dnsfilter.api.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend keeping zones in memory, for local runs and tests.
 *
 * A batch of changes is applied to a copy of the zone and only committed
 * when every change succeeds.
 */
@Component
public class InMemoryDnsBackendGateway implements DnsBackendGateway {

    public static final String NAME = "memory";

    private static final Logger log = LoggerFactory.getLogger(InMemoryDnsBackendGateway.class);

    private final Map<String, Map<String, DnsRecord>> zones = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BackendResult apply(String zone, List<RecordChange> changes) {
        Map<String, DnsRecord> current = zones.computeIfAbsent(zone, z -> new LinkedHashMap<>());
        synchronized (current) {
            Map<String, DnsRecord> working = new LinkedHashMap<>(current);
            List<DnsRecord> touched = new ArrayList<>();
            boolean changed = false;

            for (RecordChange change : changes) {
                DnsRecord record = change.record();
                switch (change.operation()) {
                    case CREATE -> {
                        DnsRecord created = record.withId(UUID.randomUUID().toString());
                        working.put(created.id(), created);
                        touched.add(created);
                        changed = true;
                    }
                    case UPDATE -> {
                        DnsRecord existing = record.id() == null
                                ? findByNameAndType(working, record.name(), record.type())
                                : working.get(record.id());
                        if (record.id() != null && !sameOwner(existing, record)) {
                            return BackendResult.failure("No record " + record.id() + " for " + record.name() + "/" + record.type());
                        }
                        String id = existing != null ? existing.id() : UUID.randomUUID().toString();
                        Integer ttl = record.ttl() != null ? record.ttl() : existing != null ? existing.ttl() : null;
                        DnsRecord updated = new DnsRecord(id, record.name(), record.type(), record.destination(), ttl);
                        if (!updated.equals(existing)) {
                            working.put(id, updated);
                            changed = true;
                        }
                        touched.add(updated);
                    }
                    case DELETE -> {
                        DnsRecord existing = record.id() == null ? null : working.get(record.id());
                        if (!sameOwner(existing, record)) {
                            return BackendResult.failure("No record " + record.id() + " for " + record.name() + "/" + record.type());
                        }
                        working.remove(existing.id());
                        touched.add(existing);
                        changed = true;
                    }
                    default -> {
                        return BackendResult.failure("Unsupported operation " + change.operation());
                    }
                }
            }

            current.clear();
            current.putAll(working);
            log.debug("Applied {} change(s) to zone {}, changed={}", changes.size(), zone, changed);
            return BackendResult.success(changed, touched);
        }
    }

    @Override
    public BackendListing listRecords(String zone) {
        Map<String, DnsRecord> current = zones.get(zone);
        if (current == null) {
            return BackendListing.of(List.of());
        }
        synchronized (current) {
            return BackendListing.of(new ArrayList<>(current.values()));
        }
    }

    /**
     * Drops every zone.
     */
    public void clear() {
        zones.clear();
    }

    private static DnsRecord findByNameAndType(Map<String, DnsRecord> records, String name, String type) {
        for (DnsRecord candidate : records.values()) {
            if (candidate.name().equals(name) && candidate.type().equals(type)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean sameOwner(DnsRecord existing, DnsRecord requested) {
        return existing != null
                && Objects.equals(existing.name(), requested.name())
                && Objects.equals(existing.type(), requested.type());
    }
}
