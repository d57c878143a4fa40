package com.dnsfilter.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthTokenTest {

    private static final String HASH = "a".repeat(64);

    @Test
    void newTokenIsActiveAndUnused() {
        AuthToken token = AuthToken.create(UUID.randomUUID(), "home", "Ab3dEf9h", HASH, null);

        assertThat(token.isActive()).isTrue();
        assertThat(token.getUseCount()).isZero();
        assertThat(token.getLastUsedAt()).isNull();
        assertThat(token.isUsable(Instant.now())).isTrue();
    }

    @Test
    void tokenExpiresAtItsExpiryInstant() {
        Instant expiry = Instant.now().plus(Duration.ofHours(1));
        AuthToken token = AuthToken.create(UUID.randomUUID(), "home", "Ab3dEf9h", HASH, expiry);

        assertThat(token.isExpired(expiry.minusMillis(1))).isFalse();
        assertThat(token.isExpired(expiry)).isTrue();
        assertThat(token.isUsable(expiry.plusSeconds(1))).isFalse();
    }

    @Test
    void revokedTokenIsNotUsableAndCannotBeRevokedTwice() {
        AuthToken token = AuthToken.create(UUID.randomUUID(), "home", "Ab3dEf9h", HASH, null);

        token.revoke("leaked");

        assertThat(token.isActive()).isFalse();
        assertThat(token.getRevokedReason()).isEqualTo("leaked");
        assertThat(token.getRevokedAt()).isNotNull();
        assertThat(token.isUsable(Instant.now())).isFalse();
        assertThatThrownBy(() -> token.revoke("again")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void hashMustBeFullSha256Hex() {
        assertThatThrownBy(() -> AuthToken.create(UUID.randomUUID(), "home", "Ab3dEf9h", "abc", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void newTokenAddsNoRestrictions() {
        AuthToken token = AuthToken.create(UUID.randomUUID(), "home", "Ab3dEf9h", HASH, null);

        assertThat(token.restrictsRecordTypes()).isFalse();
        assertThat(token.restrictsOperations()).isFalse();
        assertThat(token.getAllowedIpRanges()).isEmpty();
    }

    @Test
    void restrictionsAreStoredAsSymbols() {
        AuthToken token = AuthToken.create(UUID.randomUUID(), "home", "Ab3dEf9h", HASH, null);

        token.restrict(List.of("A"), Set.of(DnsOperation.UPDATE, DnsOperation.READ), List.of("192.0.2.0/24"));

        assertThat(token.getAllowedOperations()).containsExactly("read", "update");
        assertThat(token.getOperationSet()).containsExactlyInAnyOrder(DnsOperation.READ, DnsOperation.UPDATE);
        assertThat(token.getAllowedRecordTypes()).containsExactly("A");
        assertThat(token.getAllowedIpRanges()).containsExactly("192.0.2.0/24");
        assertThat(token.restrictsRecordTypes()).isTrue();
    }
}
