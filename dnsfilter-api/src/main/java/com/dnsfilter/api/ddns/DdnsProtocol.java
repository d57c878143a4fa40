package com.dnsfilter.api.ddns;

import com.dnsfilter.api.pipeline.Surface;

/**
 * Dynamic DNS dialects. They share success and auth tokens but differ in
 * how denials and malformed input are reported.
 */
public enum DdnsProtocol {
    DYNDNS2(Surface.DYNDNS2, "!yours", "notfqdn"),
    NOIP(Surface.NOIP, "nohost", "nohost");

    private final Surface surface;
    private final String deniedToken;
    private final String malformedToken;

    DdnsProtocol(Surface surface, String deniedToken, String malformedToken) {
        this.surface = surface;
        this.deniedToken = deniedToken;
        this.malformedToken = malformedToken;
    }

    public Surface surface() {
        return surface;
    }

    String deniedToken() {
        return deniedToken;
    }

    String malformedToken() {
        return malformedToken;
    }
}
