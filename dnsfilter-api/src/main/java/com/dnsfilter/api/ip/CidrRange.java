package com.dnsfilter.api.ip;

import org.springframework.security.web.util.matcher.IpAddressMatcher;

import java.net.InetAddress;
import java.util.Optional;

/**
 * One whitelist entry: a network in CIDR notation or a single address.
 *
 * IPv4-mapped IPv6 ranges are folded into IPv4 when the prefix keeps them
 * inside {@code ::ffff:0:0/96}; shorter mapped prefixes are rejected because
 * they would span both families.
 */
public final class CidrRange {

    private final String source;
    private final InetAddress network;
    private final int prefixLength;
    private final IpAddressMatcher matcher;

    private CidrRange(String source, InetAddress network, int prefixLength) {
        this.source = source;
        this.network = network;
        this.prefixLength = prefixLength;
        this.matcher = new IpAddressMatcher(IpAddresses.toText(network) + "/" + prefixLength);
    }

    public static Optional<CidrRange> parse(String entry) {
        if (entry == null || entry.isBlank()) {
            return Optional.empty();
        }
        String text = entry.trim();
        int slash = text.indexOf('/');
        String addressPart = slash < 0 ? text : text.substring(0, slash);
        Optional<InetAddress> address = IpAddresses.parse(addressPart);
        if (address.isEmpty()) {
            return Optional.empty();
        }

        boolean writtenAsV6 = addressPart.indexOf(':') >= 0;
        boolean mapped = writtenAsV6 && IpAddresses.isIpv4(address.get());
        int familyBits = IpAddresses.isIpv4(address.get()) && !mapped ? 32 : 128;

        int prefix = familyBits;
        if (slash >= 0) {
            String prefixPart = text.substring(slash + 1);
            if (prefixPart.isEmpty() || prefixPart.length() > 3 || !prefixPart.chars().allMatch(Character::isDigit)) {
                return Optional.empty();
            }
            prefix = Integer.parseInt(prefixPart);
            if (prefix > familyBits) {
                return Optional.empty();
            }
        }
        if (mapped) {
            if (prefix < 96) {
                return Optional.empty();
            }
            prefix -= 96;
        }
        return Optional.of(new CidrRange(text, address.get(), prefix));
    }

    /**
     * Addresses of the other family never match.
     */
    public boolean contains(InetAddress address) {
        if (address == null || IpAddresses.isIpv4(address) != IpAddresses.isIpv4(network)) {
            return false;
        }
        return matcher.matches(IpAddresses.toText(address));
    }

    /**
     * True for {@code /0}, a range that admits every address of its family.
     */
    public boolean isBroad() {
        return prefixLength == 0;
    }

    public String source() { return source; }
    public InetAddress network() { return network; }
    public int prefixLength() { return prefixLength; }

    @Override
    public String toString() {
        return IpAddresses.toText(network) + "/" + prefixLength;
    }
}
