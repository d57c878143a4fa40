package com.dnsfilter.api.backend;

import java.util.Set;

/**
 * Record type symbols this service understands. Symbols are uppercase and
 * compared exactly.
 */
public final class RecordTypes {

    public static final Set<String> SUPPORTED = Set.of(
            "A", "AAAA", "CNAME", "TXT", "MX", "NS", "SRV", "SSHFP", "CAA", "TLSA");

    private RecordTypes() {}

    public static boolean isSupported(String type) {
        return type != null && SUPPORTED.contains(type);
    }
}
