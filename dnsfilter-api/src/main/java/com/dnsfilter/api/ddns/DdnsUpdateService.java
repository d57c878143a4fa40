package com.dnsfilter.api.ddns;

import com.dnsfilter.api.authz.DomainName;
import com.dnsfilter.api.backend.RecordChange;
import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.api.ip.IpAddresses;
import com.dnsfilter.api.pipeline.DnsRequest;
import com.dnsfilter.api.pipeline.PipelineResult;
import com.dnsfilter.api.pipeline.UpdatePipeline;
import com.dnsfilter.core.domain.DnsOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a DynDNS2 or No-IP update call into a pipeline request and renders
 * the result in the caller's dialect.
 */
@Service
public class DdnsUpdateService {

    private static final Logger log = LoggerFactory.getLogger(DdnsUpdateService.class);

    private final UpdatePipeline pipeline;
    private final DdnsResponseRenderer renderer;
    private final boolean enabled;
    private final Set<String> autoIpKeywords;

    public DdnsUpdateService(
            UpdatePipeline pipeline,
            DdnsResponseRenderer renderer,
            @Value("${dnsfilter.ddns.enabled:true}") boolean enabled,
            @Value("${dnsfilter.ddns.auto-ip-keywords:auto,public,detect}") String autoIpKeywords) {
        this.pipeline = pipeline;
        this.renderer = renderer;
        this.enabled = enabled;
        this.autoIpKeywords = Arrays.stream(autoIpKeywords.split(","))
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .filter(keyword -> !keyword.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public DdnsResponse update(
            DdnsProtocol protocol,
            String token,
            String hostname,
            String myip,
            String clientIp,
            String userAgent) {

        if (!enabled) {
            DnsRequest request = DnsRequest.invalid(protocol.surface(), token, clientIp, userAgent, hostname,
                    DnsOperation.UPDATE, ErrorCode.SERVICE_DISABLED, "dynamic DNS disabled");
            PipelineResult result = pipeline.reject(request, ErrorCode.SERVICE_DISABLED, "dynamic DNS disabled");
            return renderer.render(protocol, result, null);
        }

        String ip = shouldAutoDetect(myip) ? clientIp : myip.trim();
        DnsRequest request = buildRequest(protocol, token, hostname, ip, clientIp, userAgent);
        PipelineResult result = pipeline.process(request);

        String renderedIp = request.changes().isEmpty() ? null : request.changes().get(0).record().destination();
        DdnsResponse response = renderer.render(protocol, result, renderedIp);
        log.info("DDNS {} update for {} -> {} ({})", protocol.surface().symbol(), hostname,
                response.body(), response.httpStatus());
        return response;
    }

    boolean shouldAutoDetect(String myip) {
        return myip == null || myip.isBlank() || autoIpKeywords.contains(myip.trim().toLowerCase(Locale.ROOT));
    }

    private DnsRequest buildRequest(DdnsProtocol protocol, String token, String hostname,
                                    String ip, String clientIp, String userAgent) {
        if (hostname == null || hostname.isBlank()) {
            return DnsRequest.invalid(protocol.surface(), token, clientIp, userAgent, null,
                    DnsOperation.UPDATE, ErrorCode.MISSING_PARAMETER, "hostname parameter required");
        }
        Optional<String> fqdn = normalizeHostname(hostname);
        if (fqdn.isEmpty()) {
            return DnsRequest.invalid(protocol.surface(), token, clientIp, userAgent, hostname,
                    DnsOperation.UPDATE, ErrorCode.INVALID_HOSTNAME, "invalid hostname format");
        }
        Optional<InetAddress> address = IpAddresses.parse(ip);
        if (address.isEmpty()) {
            return DnsRequest.invalid(protocol.surface(), token, clientIp, userAgent, fqdn.get(),
                    DnsOperation.UPDATE, ErrorCode.INVALID_IP, "invalid IP address: " + ip);
        }

        String recordType = IpAddresses.isIpv4(address.get()) ? "A" : "AAAA";
        RecordChange change = RecordChange.upsert(fqdn.get(), recordType, IpAddresses.toText(address.get()));
        return DnsRequest.change(protocol.surface(), token, clientIp, userAgent, fqdn.get(), change);
    }

    /**
     * Host names as DDNS clients send them: letters, digits and hyphens only.
     */
    static Optional<String> normalizeHostname(String hostname) {
        if (hostname.indexOf('_') >= 0) {
            return Optional.empty();
        }
        return DomainName.normalize(hostname);
    }
}
