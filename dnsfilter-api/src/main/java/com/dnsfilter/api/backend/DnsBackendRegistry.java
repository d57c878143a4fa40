package com.dnsfilter.api.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered backend gateways by name.
 */
@Component
public class DnsBackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(DnsBackendRegistry.class);

    private final Map<String, DnsBackendGateway> gateways = new HashMap<>();

    public DnsBackendRegistry(List<DnsBackendGateway> gateways) {
        for (DnsBackendGateway gateway : gateways) {
            DnsBackendGateway previous = this.gateways.put(gateway.name(), gateway);
            if (previous != null) {
                throw new IllegalStateException("Duplicate DNS backend name: " + gateway.name());
            }
        }
        log.info("Registered DNS backends: {}", this.gateways.keySet());
    }

    public Optional<DnsBackendGateway> forBackend(String name) {
        return Optional.ofNullable(name).map(gateways::get);
    }
}
