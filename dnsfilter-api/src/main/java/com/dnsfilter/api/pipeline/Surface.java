package com.dnsfilter.api.pipeline;

import java.util.Locale;

/**
 * Client-facing protocol a request arrived through.
 */
public enum Surface {
    DYNDNS2,
    NOIP,
    API;

    public String symbol() {
        return name().toLowerCase(Locale.ROOT);
    }
}
