package com.dnsfilter.api.authz;

import java.util.Locale;
import java.util.Objects;

/**
 * Authorization decision. A denial always carries exactly one reason.
 */
public sealed interface Decision permits Decision.Allow, Decision.Deny {

    Decision ALLOW = new Allow();

    static Decision allow() {
        return ALLOW;
    }

    static Decision deny(DenialReason reason) {
        return new Deny(reason);
    }

    boolean isAllowed();

    /**
     * Lowercase label for audit entries: {@code allow} or the denial reason.
     */
    String label();

    record Allow() implements Decision {

        @Override
        public boolean isAllowed() {
            return true;
        }

        @Override
        public String label() {
            return "allow";
        }
    }

    record Deny(DenialReason reason) implements Decision {

        public Deny {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isAllowed() {
            return false;
        }

        @Override
        public String label() {
            return reason.name().toLowerCase(Locale.ROOT);
        }
    }
}
