package com.dnsfilter.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * DNS record operations a realm can grant.
 * READ is independent of the three mutating operations.
 */
public enum DnsOperation {
    READ,
    CREATE,
    UPDATE,
    DELETE;

    public boolean isMutation() {
        return this != READ;
    }

    /**
     * Lowercase symbol used in storage, audit entries and API payloads.
     */
    public String symbol() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DnsOperation> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        for (DnsOperation op : values()) {
            if (op.symbol().equals(symbol.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
