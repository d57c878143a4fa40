package com.dnsfilter.api.ip;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IpWhitelistValidatorTest {

    private final IpWhitelistValidator validator = new IpWhitelistValidator(true);

    @Test
    void emptyWhitelistAllowsEverything() {
        assertThat(validator.isIpAllowed(List.of(), "203.0.113.9").allowed()).isTrue();
        assertThat(validator.isIpAllowed(null, "2001:db8::1").allowed()).isTrue();
    }

    @Test
    void matchesCidrRangesAndSingleAddresses() {
        List<String> ranges = List.of("10.0.0.0/8", "192.168.1.10", "2001:db8::/32");

        assertThat(validator.isIpAllowed(ranges, "10.200.3.4").allowed()).isTrue();
        assertThat(validator.isIpAllowed(ranges, "192.168.1.10").allowed()).isTrue();
        assertThat(validator.isIpAllowed(ranges, "192.168.1.11").allowed()).isFalse();
        assertThat(validator.isIpAllowed(ranges, "2001:db8:ffff::1").allowed()).isTrue();
        assertThat(validator.isIpAllowed(ranges, "2001:db9::1").allowed()).isFalse();
    }

    @Test
    void malformedEntryFailsClosedForEveryAddress() {
        WhitelistVerdict verdict = validator.isIpAllowed(List.of("10.0.0.0/8", "10.0.0.0/33"), "10.0.0.1");

        assertThat(verdict.allowed()).isFalse();
        assertThat(verdict.isMisconfigured()).isTrue();
        assertThat(verdict.misconfiguredEntry()).isEqualTo("10.0.0.0/33");
    }

    @Test
    void malformedSourceNeverMatches() {
        WhitelistVerdict verdict = validator.isIpAllowed(List.of("10.0.0.0/8"), "not-an-ip");

        assertThat(verdict.allowed()).isFalse();
        assertThat(verdict.isMisconfigured()).isFalse();
    }

    @Test
    void familiesDoNotCrossExceptForMappedAddresses() {
        assertThat(validator.isIpAllowed(List.of("10.0.0.0/8"), "2001:db8::1").allowed()).isFalse();
        assertThat(validator.isIpAllowed(List.of("2001:db8::/32"), "10.0.0.1").allowed()).isFalse();
        assertThat(validator.isIpAllowed(List.of("10.0.0.0/8"), "::ffff:10.1.2.3").allowed()).isTrue();
        assertThat(validator.isIpAllowed(List.of("::ffff:10.0.0.0/104"), "10.1.2.3").allowed()).isTrue();
        assertThat(validator.isIpAllowed(List.of("::ffff:10.0.0.0/104"), "11.1.2.3").allowed()).isFalse();
    }

    @Test
    void broadRangesAreAConfigurationErrorByDefault() {
        assertThat(validator.isIpAllowed(List.of("0.0.0.0/0"), "10.0.0.1").isMisconfigured()).isTrue();
        assertThat(validator.isIpAllowed(List.of("::/0"), "2001:db8::1").isMisconfigured()).isTrue();
    }

    @Test
    void broadRangesCanBeHonored() {
        IpWhitelistValidator permissive = new IpWhitelistValidator(false);

        assertThat(permissive.isIpAllowed(List.of("0.0.0.0/0"), "198.51.100.7").allowed()).isTrue();
        assertThat(permissive.isIpAllowed(List.of("0.0.0.0/0"), "2001:db8::1").allowed()).isFalse();
    }

    @Test
    void validateRangesReportsEachProblem() {
        List<String> problems = validator.validateRanges(List.of("10.0.0.0/8", "bogus", "::/0"), false);

        assertThat(problems).hasSize(2);
        assertThat(validator.validateRanges(List.of("::/0"), true)).isEmpty();
    }

    @Property(tries = 100)
    void emptyWhitelistAllowsAnyIpv4(@ForAll("ipv4") String ip) {
        assert validator.isIpAllowed(List.of(), ip).allowed() : "denied " + ip;
    }

    @Property(tries = 100)
    void singleAddressEntryMatchesOnlyItself(@ForAll("ipv4") String entry, @ForAll("ipv4") String source) {
        boolean allowed = validator.isIpAllowed(List.of(entry), source).allowed();
        assert allowed == entry.equals(source) : entry + " vs " + source + " -> " + allowed;
    }

    @Provide
    Arbitrary<String> ipv4() {
        Arbitrary<Integer> octet = Arbitraries.integers().between(0, 255);
        return Combinators.combine(octet, octet, octet, octet)
                .as((a, b, c, d) -> a + "." + b + "." + c + "." + d);
    }
}
