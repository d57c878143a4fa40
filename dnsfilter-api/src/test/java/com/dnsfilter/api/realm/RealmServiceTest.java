package com.dnsfilter.api.realm;

import com.dnsfilter.api.support.TestData;
import com.dnsfilter.api.token.TokenService;
import com.dnsfilter.core.domain.Account;
import com.dnsfilter.core.domain.DnsOperation;
import com.dnsfilter.core.domain.Realm;
import com.dnsfilter.core.domain.Realm.RealmType;
import com.dnsfilter.core.repository.RealmRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class RealmServiceTest {

    @Autowired
    private RealmService realmService;

    @Autowired
    private TokenService tokenService;

    @Autowired
    private RealmRepository realmRepository;

    @Autowired
    private TestData testData;

    private Account account;

    @BeforeEach
    void setUp() {
        testData.reset();
        account = testData.approvedAccount();
    }

    private RealmService.CreateRealmCommand command(RealmType type, String value, List<String> ranges, boolean allowBroad) {
        return new RealmService.CreateRealmCommand(account.getId(), type, value,
                List.of("A", "AAAA"), Set.of(DnsOperation.READ, DnsOperation.UPDATE), ranges, allowBroad);
    }

    @Test
    void createRealm_normalizesAndStores() {
        Realm realm = realmService.createRealm(command(RealmType.SUBDOMAIN, "Lab.Example.COM.",
                List.of(" 10.0.0.0/8 ", "", "2001:db8::/32"), false));

        Realm stored = realmRepository.findById(realm.getId()).orElseThrow();
        assertEquals("lab.example.com", stored.getRealmValue());
        assertEquals(List.of("10.0.0.0/8", "2001:db8::/32"), stored.getAllowedIpRanges());
        assertEquals(Set.of(DnsOperation.READ, DnsOperation.UPDATE), stored.getOperationSet());
        assertEquals(List.of("A", "AAAA"), stored.getRecordTypes());
    }

    @Test
    void createRealm_rejectsBadInput() {
        assertThrows(RealmService.InvalidRealmException.class,
                () -> realmService.createRealm(command(RealmType.HOST, "localhost", List.of(), false)));
        assertThrows(RealmService.InvalidRealmException.class,
                () -> realmService.createRealm(command(RealmType.HOST, "a.example.com", List.of("10.0.0.0/40"), false)));
        assertThrows(RealmService.InvalidRealmException.class,
                () -> realmService.createRealm(command(null, "a.example.com", List.of(), false)));
        assertThrows(RealmService.InvalidRealmException.class,
                () -> realmService.createRealm(new RealmService.CreateRealmCommand(account.getId(), RealmType.HOST,
                        "a.example.com", List.of("a"), Set.of(), List.of(), false)));
        assertThrows(RealmService.InvalidRealmException.class,
                () -> realmService.createRealm(new RealmService.CreateRealmCommand(UUID.randomUUID(), RealmType.HOST,
                        "a.example.com", List.of(), Set.of(), List.of(), false)));
    }

    @Test
    void createRealm_broadRangeNeedsExplicitOptIn() {
        assertThrows(RealmService.InvalidRealmException.class,
                () -> realmService.createRealm(command(RealmType.HOST, "a.example.com", List.of("0.0.0.0/0"), false)));

        Realm realm = realmService.createRealm(command(RealmType.HOST, "a.example.com", List.of("0.0.0.0/0"), true));
        assertEquals(List.of("0.0.0.0/0"), realm.getAllowedIpRanges());
    }

    @Test
    void createRealm_rejectsDuplicate() {
        realmService.createRealm(command(RealmType.HOST, "a.example.com", List.of(), false));

        assertThrows(RealmService.DuplicateRealmException.class,
                () -> realmService.createRealm(command(RealmType.HOST, "A.example.com", List.of(), false)));
        assertDoesNotThrow(() -> realmService.createRealm(command(RealmType.SUBDOMAIN, "a.example.com", List.of(), false)));
    }

    @Test
    void updateAllowedIpRanges_validatesBeforeStoring() {
        Realm realm = realmService.createRealm(command(RealmType.HOST, "a.example.com", List.of("10.0.0.0/8"), false));

        assertThrows(RealmService.InvalidRealmException.class,
                () -> realmService.updateAllowedIpRanges(realm.getId(), List.of("bogus"), false));
        assertEquals(List.of("10.0.0.0/8"), realmRepository.findById(realm.getId()).orElseThrow().getAllowedIpRanges());

        realmService.updateAllowedIpRanges(realm.getId(), List.of("192.0.2.0/24"), false);
        assertEquals(List.of("192.0.2.0/24"), realmRepository.findById(realm.getId()).orElseThrow().getAllowedIpRanges());
    }

    @Test
    void deleteRealm_removesItsTokens() {
        Realm realm = realmService.createRealm(command(RealmType.HOST, "a.example.com", List.of(), false));
        tokenService.issueToken(realm.getId(), "one", null);
        tokenService.issueToken(realm.getId(), "two", null);

        realmService.deleteRealm(realm.getId());

        assertFalse(realmRepository.existsById(realm.getId()));
        assertTrue(tokenService.listTokens(realm.getId()).isEmpty());
        assertThrows(RealmService.RealmNotFoundException.class, () -> realmService.deleteRealm(realm.getId()));
    }

    @Test
    void listRealms_returnsOnlyAccountRealms() {
        Realm first = realmService.createRealm(command(RealmType.HOST, "a.example.com", List.of(), false));
        Realm second = realmService.createRealm(command(RealmType.WILDCARD, "dyn.example.com", List.of(), false));
        testData.realm(testData.approvedAccount(), RealmType.HOST, "b.example.com");

        Set<UUID> ids = realmService.listRealms(account.getId()).stream()
                .map(Realm::getId)
                .collect(Collectors.toSet());

        assertEquals(Set.of(first.getId(), second.getId()), ids);
    }
}
