package com.dnsfilter.api.ddns;

import com.dnsfilter.api.backend.DnsRecord;
import com.dnsfilter.api.backend.InMemoryDnsBackendGateway;
import com.dnsfilter.api.support.FailingDnsBackendGateway;
import com.dnsfilter.api.support.TestData;
import com.dnsfilter.core.domain.Account;
import com.dnsfilter.core.domain.ActivityLog;
import com.dnsfilter.core.domain.ActivityLog.ActivityType;
import com.dnsfilter.core.domain.ActivityLog.Severity;
import com.dnsfilter.core.domain.ActivityLog.Status;
import com.dnsfilter.core.domain.Realm;
import com.dnsfilter.core.domain.Realm.RealmType;
import com.dnsfilter.core.repository.ActivityLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end DynDNS2 and No-IP update calls against the in-memory backend.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DdnsControllerIntegrationTest {

    private static final String DYNDNS2 = "/nic/update";
    private static final String NOIP = "/api/ddns/noip/update";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestData testData;

    @Autowired
    private ActivityLogRepository activityLogRepository;

    @Autowired
    private InMemoryDnsBackendGateway memoryBackend;

    private Account account;
    private String token;

    @BeforeEach
    void setUp() {
        testData.reset();
        testData.root("example.com", false, 1, 3);
        account = testData.approvedAccount();
        Realm realm = testData.realm(account, RealmType.HOST, "home.example.com");
        token = testData.token(realm);
    }

    private static MockHttpServletRequestBuilder update(String path, String token, String remoteAddr) {
        MockHttpServletRequestBuilder request = get(path).with(r -> {
            r.setRemoteAddr(remoteAddr);
            return r;
        });
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return request;
    }

    private String body(MockHttpServletRequestBuilder request, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(request)
                .andExpect(status().is(expectedStatus))
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andReturn();
        return result.getResponse().getContentAsString();
    }

    private ActivityLog onlyAuditEntry() {
        List<ActivityLog> entries = activityLogRepository.findAll();
        assertThat(entries).hasSize(1);
        return entries.get(0);
    }

    @Test
    void updatesThenReportsNoChange() throws Exception {
        String first = body(update(DYNDNS2, token, "198.51.100.20")
                .param("hostname", "home.example.com")
                .param("myip", "203.0.113.5"), 200);
        String second = body(update(DYNDNS2, token, "198.51.100.20")
                .param("hostname", "HOME.example.com.")
                .param("myip", "203.0.113.5"), 200);

        assertThat(first).isEqualTo("good 203.0.113.5");
        assertThat(second).isEqualTo("nochg 203.0.113.5");
        assertThat(memoryBackend.listRecords("example.com").records())
                .extracting(DnsRecord::name, DnsRecord::type, DnsRecord::destination)
                .containsExactly(tuple("home.example.com", "A", "203.0.113.5"));
    }

    @Test
    void successIsAuditedWithAttribution() throws Exception {
        body(update(DYNDNS2, token, "198.51.100.20")
                .param("hostname", "home.example.com")
                .param("myip", "203.0.113.5")
                .header("User-Agent", "ddclient/3.11"), 200);

        ActivityLog entry = onlyAuditEntry();
        assertThat(entry.getActivityType()).isEqualTo(ActivityType.DNS_UPDATE);
        assertThat(entry.getStatus()).isEqualTo(Status.SUCCESS);
        assertThat(entry.getAccountId()).isEqualTo(account.getId());
        assertThat(entry.getSurface()).isEqualTo("dyndns2");
        assertThat(entry.getSourceIp()).isEqualTo("198.51.100.20");
        assertThat(entry.getUserAgent()).isEqualTo("ddclient/3.11");
        assertThat(entry.getDomain()).isEqualTo("home.example.com");
        assertThat(entry.getRecordTypes()).containsExactly("A");
        assertThat(entry.getDecision()).isEqualTo("allow");
        assertThat(entry.getErrorCode()).isNull();
        assertThat(entry.getTokenFingerprint()).isNotBlank().doesNotContain(token);
    }

    @Test
    void legacyAndPrefixedPathsBehaveAlike() throws Exception {
        String legacy = body(update(DYNDNS2, token, "127.0.0.1")
                .param("hostname", "home.example.com")
                .param("myip", "192.0.2.1"), 200);
        String prefixed = body(update("/api/ddns/dyndns2/update", token, "127.0.0.1")
                .param("hostname", "home.example.com")
                .param("myip", "192.0.2.1"), 200);

        assertThat(legacy).isEqualTo("good 192.0.2.1");
        assertThat(prefixed).isEqualTo("nochg 192.0.2.1");
    }

    @Test
    void acceptsFormEncodedPost() throws Exception {
        MockHttpServletRequestBuilder request = post(NOIP)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .header("Authorization", "Bearer " + token)
                .param("hostname", "home.example.com")
                .param("myip", "192.0.2.44");

        assertThat(body(request, 200)).isEqualTo("good 192.0.2.44");
    }

    @Test
    void outOfScopeHostIsNotYours() throws Exception {
        String dyndns = body(update(DYNDNS2, token, "127.0.0.1")
                .param("hostname", "office.example.com")
                .param("myip", "192.0.2.1"), 403);
        String noip = body(update(NOIP, token, "127.0.0.1")
                .param("hostname", "office.example.com")
                .param("myip", "192.0.2.1"), 403);

        assertThat(dyndns).isEqualTo("!yours");
        assertThat(noip).isEqualTo("nohost");
        assertThat(memoryBackend.listRecords("example.com").records()).isEmpty();
        assertThat(activityLogRepository.findAll())
                .hasSize(2)
                .allSatisfy(entry -> {
                    assertThat(entry.getErrorCode()).isEqualTo("domain_denied");
                    assertThat(entry.getActivityType()).isEqualTo(ActivityType.SECURITY_EVENT);
                    assertThat(entry.getDecision()).isEqualTo("out_of_scope");
                });
    }

    @Test
    void unmanagedDomainIsNotYours() throws Exception {
        Realm other = testData.realm(account, RealmType.HOST, "home.example.org");
        String otherToken = testData.token(other);

        String response = body(update(DYNDNS2, otherToken, "127.0.0.1")
                .param("hostname", "home.example.org")
                .param("myip", "192.0.2.1"), 403);

        assertThat(response).isEqualTo("!yours");
        assertThat(onlyAuditEntry().getErrorCode()).isEqualTo("no_domain_root");
    }

    @Test
    void unknownTokenAndWrongSecretLookIdentical() throws Exception {
        String secret = token.substring(token.lastIndexOf('_') + 1);
        String wrongSecret = "naf_client_" + secret.substring(0, 8) + "Q".repeat(40);
        String unknown = "naf_client_" + "Zz9".repeat(16);

        MvcResult wrong = mockMvc.perform(update(DYNDNS2, wrongSecret, "127.0.0.1")
                        .param("hostname", "home.example.com").param("myip", "192.0.2.1"))
                .andReturn();
        MvcResult missing = mockMvc.perform(update(DYNDNS2, unknown, "127.0.0.1")
                        .param("hostname", "home.example.com").param("myip", "192.0.2.1"))
                .andReturn();

        assertThat(wrong.getResponse().getStatus()).isEqualTo(401);
        assertThat(missing.getResponse().getStatus()).isEqualTo(401);
        assertThat(wrong.getResponse().getContentAsString()).isEqualTo("badauth");
        assertThat(missing.getResponse().getContentAsString()).isEqualTo("badauth");
        assertThat(wrong.getResponse().getHeaderNames()).isEqualTo(missing.getResponse().getHeaderNames());
    }

    @Test
    void wrongSecretIsRecordedAsAttack() throws Exception {
        String secret = token.substring(token.lastIndexOf('_') + 1);
        String wrongSecret = "naf_client_" + secret.substring(0, 8) + "Q".repeat(40);

        body(update(DYNDNS2, wrongSecret, "203.0.113.9")
                .param("hostname", "home.example.com").param("myip", "192.0.2.1"), 401);

        ActivityLog entry = onlyAuditEntry();
        assertThat(entry.getActivityType()).isEqualTo(ActivityType.FAILED_AUTH);
        assertThat(entry.getStatus()).isEqualTo(Status.FAILURE);
        assertThat(entry.getErrorCode()).isEqualTo("token_hash_mismatch");
        assertThat(entry.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(entry.isAttack()).isTrue();
        assertThat(entry.getAccountId()).isNull();
    }

    @Test
    void missingTokenIsBadauth() throws Exception {
        assertThat(body(update(DYNDNS2, null, "127.0.0.1")
                .param("hostname", "home.example.com").param("myip", "192.0.2.1"), 401))
                .isEqualTo("badauth");
        assertThat(onlyAuditEntry().getErrorCode()).isEqualTo("missing_token");
    }

    @Test
    void malformedInputIsReportedOnlyAfterAuthentication() throws Exception {
        assertThat(body(update(DYNDNS2, null, "127.0.0.1").param("myip", "192.0.2.1"), 401))
                .isEqualTo("badauth");
        assertThat(body(update(DYNDNS2, token, "127.0.0.1").param("myip", "192.0.2.1"), 400))
                .isEqualTo("notfqdn");
    }

    @Test
    void malformedInputUsesDialectToken() throws Exception {
        assertThat(body(update(DYNDNS2, token, "127.0.0.1")
                .param("hostname", "home.example.com").param("myip", "999.1.1.1"), 400))
                .isEqualTo("notfqdn");
        assertThat(body(update(DYNDNS2, token, "127.0.0.1")
                .param("hostname", "bad_name.example.com").param("myip", "192.0.2.1"), 400))
                .isEqualTo("notfqdn");
        assertThat(body(update(NOIP, token, "127.0.0.1")
                .param("hostname", "home.example.com").param("myip", "not-an-ip"), 400))
                .isEqualTo("nohost");
        assertThat(activityLogRepository.findAll())
                .extracting(ActivityLog::getErrorCode)
                .containsExactlyInAnyOrder("invalid_ip", "invalid_hostname", "invalid_ip");
    }

    @Test
    void detectsCallerAddressWhenMyipIsMissingOrAKeyword() throws Exception {
        assertThat(body(update(DYNDNS2, token, "198.51.100.20").param("hostname", "home.example.com"), 200))
                .isEqualTo("good 198.51.100.20");
        assertThat(body(update(DYNDNS2, token, "198.51.100.20")
                .param("hostname", "home.example.com").param("myip", "AUTO"), 200))
                .isEqualTo("nochg 198.51.100.20");
    }

    @Test
    void ipv6AddressBecomesAaaaRecord() throws Exception {
        assertThat(body(update(DYNDNS2, token, "127.0.0.1")
                .param("hostname", "home.example.com").param("myip", "2001:DB8:0:0:0:0:0:1"), 200))
                .isEqualTo("good 2001:db8::1");

        assertThat(memoryBackend.listRecords("example.com").records())
                .singleElement()
                .satisfies(record -> {
                    assertThat(record.type()).isEqualTo("AAAA");
                    assertThat(record.destination()).isEqualTo("2001:db8::1");
                });
    }

    @Test
    void whitelistRestrictsSourceAddress() throws Exception {
        Realm fenced = testData.realm(account, RealmType.HOST, "fenced.example.com",
                List.of(), Set.of(), List.of("10.0.0.0/8"));
        String fencedToken = testData.token(fenced);

        assertThat(body(update(DYNDNS2, fencedToken, "203.0.113.9")
                .param("hostname", "fenced.example.com").param("myip", "192.0.2.1"), 403))
                .isEqualTo("!yours");
        assertThat(body(update(DYNDNS2, fencedToken, "10.1.2.3")
                .param("hostname", "fenced.example.com").param("myip", "192.0.2.1"), 200))
                .isEqualTo("good 192.0.2.1");

        assertThat(activityLogRepository.findAll())
                .extracting(ActivityLog::getErrorCode)
                .containsExactlyInAnyOrder("ip_denied", null);
    }

    @Test
    void backendFailureIsDnserr() throws Exception {
        testData.root("example.net", FailingDnsBackendGateway.NAME, false, 1, 3);
        Realm realm = testData.realm(account, RealmType.HOST, "home.example.net");
        String netToken = testData.token(realm);

        assertThat(body(update(DYNDNS2, netToken, "127.0.0.1")
                .param("hostname", "home.example.net").param("myip", "192.0.2.1"), 502))
                .isEqualTo("dnserr");

        ActivityLog entry = onlyAuditEntry();
        assertThat(entry.getErrorCode()).isEqualTo("backend_error");
        assertThat(entry.getStatus()).isEqualTo(Status.ERROR);
    }

    @Test
    void unknownBackendIsDnserr() throws Exception {
        testData.root("example.net", "no-such-backend", false, 1, 3);
        Realm realm = testData.realm(account, RealmType.HOST, "home.example.net");
        String netToken = testData.token(realm);

        assertThat(body(update(NOIP, netToken, "127.0.0.1")
                .param("hostname", "home.example.net").param("myip", "192.0.2.1"), 502))
                .isEqualTo("dnserr");
        assertThat(onlyAuditEntry().getErrorCode()).isEqualTo("backend_unavailable");
    }

    @Test
    void everyRequestWritesExactlyOneAuditEntry() throws Exception {
        body(update(DYNDNS2, token, "127.0.0.1").param("hostname", "home.example.com").param("myip", "192.0.2.1"), 200);
        body(update(DYNDNS2, token, "127.0.0.1").param("hostname", "home.example.com").param("myip", "192.0.2.1"), 200);
        body(update(DYNDNS2, null, "127.0.0.1").param("hostname", "home.example.com"), 401);
        body(update(NOIP, token, "127.0.0.1").param("hostname", "office.example.com"), 403);
        body(update(NOIP, token, "127.0.0.1"), 400);

        assertThat(activityLogRepository.count()).isEqualTo(5);
    }
}
