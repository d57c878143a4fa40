package com.dnsfilter.api.ip;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks a source address against a realm's allowed ranges.
 *
 * An empty list admits everyone. Any malformed entry fails the whole check
 * closed, as does a {@code /0} range unless broad ranges are enabled.
 */
@Component
public class IpWhitelistValidator {

    private static final Logger log = LoggerFactory.getLogger(IpWhitelistValidator.class);

    private final boolean rejectBroadRanges;

    public IpWhitelistValidator(@Value("${dnsfilter.ip-whitelist.reject-broad-ranges:true}") boolean rejectBroadRanges) {
        this.rejectBroadRanges = rejectBroadRanges;
    }

    public WhitelistVerdict isIpAllowed(List<String> allowedRanges, String sourceIp) {
        if (allowedRanges == null || allowedRanges.isEmpty()) {
            return WhitelistVerdict.allow();
        }

        List<CidrRange> ranges = new ArrayList<>(allowedRanges.size());
        for (String entry : allowedRanges) {
            Optional<CidrRange> range = CidrRange.parse(entry);
            if (range.isEmpty()) {
                log.error("Malformed IP whitelist entry '{}'", entry);
                return WhitelistVerdict.misconfigured(entry, "malformed entry");
            }
            if (range.get().isBroad()) {
                if (rejectBroadRanges) {
                    log.error("IP whitelist entry '{}' admits every address and is rejected", entry);
                    return WhitelistVerdict.misconfigured(entry, "broad range");
                }
                log.warn("IP whitelist entry '{}' admits every address", entry);
            }
            ranges.add(range.get());
        }

        Optional<InetAddress> source = IpAddresses.parse(sourceIp);
        if (source.isEmpty()) {
            return WhitelistVerdict.deny("unparseable source address");
        }
        for (CidrRange range : ranges) {
            if (range.contains(source.get())) {
                return WhitelistVerdict.allow();
            }
        }
        return WhitelistVerdict.deny("source address not in whitelist");
    }

    /**
     * Validates entries before they are stored.
     *
     * @return one problem description per rejected entry, empty when all are acceptable
     */
    public List<String> validateRanges(List<String> entries, boolean allowBroadRanges) {
        List<String> problems = new ArrayList<>();
        if (entries == null) {
            return problems;
        }
        for (String entry : entries) {
            Optional<CidrRange> range = CidrRange.parse(entry);
            if (range.isEmpty()) {
                problems.add("Invalid IP range: " + entry);
            } else if (range.get().isBroad() && !allowBroadRanges) {
                problems.add("IP range admits every address: " + entry);
            }
        }
        return problems;
    }
}
