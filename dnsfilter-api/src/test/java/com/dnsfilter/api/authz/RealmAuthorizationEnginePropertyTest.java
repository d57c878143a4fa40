package com.dnsfilter.api.authz;

import com.dnsfilter.core.domain.AuthToken;
import com.dnsfilter.core.domain.DnsOperation;
import com.dnsfilter.core.domain.Realm;
import com.dnsfilter.core.domain.Realm.RealmType;
import net.jqwik.api.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Scope properties of the authorization engine over generated names.
 */
class RealmAuthorizationEnginePropertyTest {

    private static final DomainRootPolicy ROOT = DomainRootPolicy.of("example.com", "memory", true, 1, 10);

    private final RealmAuthorizationEngine engine = new RealmAuthorizationEngine();

    @Property(tries = 100)
    void subdomainRealmAllowsEveryDescendant(
            @ForAll("labels") List<String> extra,
            @ForAll("label") String realmLabel) {

        String realmValue = realmLabel + ".example.com";
        String target = String.join(".", extra) + "." + realmValue;
        Realm realm = Realm.create(UUID.randomUUID(), RealmType.SUBDOMAIN, realmValue, List.of(), Set.of(), List.of());

        Decision decision = engine.authorize(realm, null, target, List.of("A"), DnsOperation.UPDATE, ROOT);
        assert decision.isAllowed() : target + " denied under " + realmValue + ": " + decision;
    }

    @Property(tries = 100)
    void prefixGluedNamesAreNeverInScope(
            @ForAll("label") String glue,
            @ForAll("label") String realmLabel,
            @ForAll RealmType type) {

        String realmValue = realmLabel + ".example.com";
        String target = glue + realmValue;
        Realm realm = Realm.create(UUID.randomUUID(), type, realmValue, List.of(), Set.of(), List.of());

        Decision decision = engine.authorize(realm, null, target, List.of("A"), DnsOperation.UPDATE, ROOT);
        assert decision.equals(Decision.deny(DenialReason.OUT_OF_SCOPE)) : target + " -> " + decision;
    }

    @Property(tries = 100)
    void wildcardNeverCoversItsOwnName(@ForAll("label") String realmLabel) {
        String realmValue = realmLabel + ".example.com";
        Realm realm = Realm.create(UUID.randomUUID(), RealmType.WILDCARD, realmValue, List.of(), Set.of(), List.of());

        assert !engine.isInRealmScope(realm, realmValue) : "wildcard covered " + realmValue;
    }

    @Property(tries = 100)
    void parentsAreNeverInScope(@ForAll("labels") List<String> extra, @ForAll RealmType type) {
        String realmValue = String.join(".", extra) + ".example.com";
        Realm realm = Realm.create(UUID.randomUUID(), type, realmValue, List.of(), Set.of(), List.of());

        assert !engine.isInRealmScope(realm, "example.com") : "parent in scope of " + realmValue;
    }

    @Property(tries = 100)
    void tokenRestrictionsNeverWidenTheRealm(
            @ForAll("recordTypes") List<String> realmTypes,
            @ForAll Set<DnsOperation> realmOperations,
            @ForAll("recordTypes") List<String> tokenTypes,
            @ForAll Set<DnsOperation> tokenOperations,
            @ForAll("recordType") String requestedType,
            @ForAll DnsOperation operation) {

        Realm realm = Realm.create(UUID.randomUUID(), RealmType.SUBDOMAIN, "lab.example.com",
                realmTypes, realmOperations, List.of());
        AuthToken token = AuthToken.create(realm.getId(), "client", "Ab3dEf9h", "a".repeat(64), null);
        token.restrict(tokenTypes, tokenOperations, List.of());

        Decision withToken = engine.authorize(realm, token, "a.lab.example.com", List.of(requestedType), operation, ROOT);
        Decision realmOnly = engine.authorize(realm, null, "a.lab.example.com", List.of(requestedType), operation, ROOT);
        assert !withToken.isAllowed() || realmOnly.isAllowed()
                : "token widened " + realmTypes + "/" + realmOperations + " to " + requestedType + "/" + operation;
    }

    @Provide
    Arbitrary<String> recordType() {
        return Arbitraries.of("A", "AAAA", "TXT", "MX", "CNAME");
    }

    @Provide
    Arbitrary<List<String>> recordTypes() {
        return recordType().set().ofMaxSize(3).map(List::copyOf);
    }

    @Provide
    Arbitrary<String> label() {
        return Arbitraries.strings().withCharRange('a', 'z').withCharRange('0', '9').ofMinLength(1).ofMaxLength(12);
    }

    @Provide
    Arbitrary<List<String>> labels() {
        return label().list().ofMinSize(1).ofMaxSize(4);
    }
}
