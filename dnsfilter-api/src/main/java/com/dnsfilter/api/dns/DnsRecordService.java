package com.dnsfilter.api.dns;

import com.dnsfilter.api.authz.DomainName;
import com.dnsfilter.api.backend.DnsRecord;
import com.dnsfilter.api.backend.RecordChange;
import com.dnsfilter.api.backend.RecordTypes;
import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.api.ip.IpAddresses;
import com.dnsfilter.api.pipeline.DnsRequest;
import com.dnsfilter.api.pipeline.PipelineResult;
import com.dnsfilter.api.pipeline.Surface;
import com.dnsfilter.api.pipeline.UpdatePipeline;
import com.dnsfilter.core.domain.DnsOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.util.Optional;

/**
 * Record-level operations of the JSON API, each one pipeline run.
 */
@Service
public class DnsRecordService {

    private static final Logger log = LoggerFactory.getLogger(DnsRecordService.class);

    static final int MIN_TTL = 60;
    static final int MAX_TTL = 86400;
    static final int MAX_DESTINATION_LENGTH = 2048;

    private final UpdatePipeline pipeline;
    private final ObjectMapper objectMapper;

    public DnsRecordService(UpdatePipeline pipeline, ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
    }

    public PipelineResult listRecords(Caller caller, String domain) {
        Optional<String> name = DomainName.normalize(domain);
        if (name.isEmpty()) {
            return pipeline.process(invalid(caller, domain, DnsOperation.READ,
                    ErrorCode.INVALID_HOSTNAME, "invalid domain"));
        }
        return pipeline.process(DnsRequest.read(Surface.API, caller.token(), caller.sourceIp(),
                caller.userAgent(), name.get()));
    }

    /**
     * @param rawBody JSON request body as received, possibly null or malformed
     */
    public PipelineResult createRecord(Caller caller, String domain, String rawBody) {
        return change(caller, domain, DnsOperation.CREATE, null, rawBody);
    }

    public PipelineResult updateRecord(Caller caller, String domain, String recordId, String rawBody) {
        return change(caller, domain, DnsOperation.UPDATE, recordId, rawBody);
    }

    public PipelineResult deleteRecord(Caller caller, String domain, String recordId, String type) {
        Optional<String> name = DomainName.normalize(domain);
        if (name.isEmpty()) {
            return pipeline.process(invalid(caller, domain, DnsOperation.DELETE,
                    ErrorCode.INVALID_HOSTNAME, "invalid domain"));
        }
        if (type == null || type.isBlank()) {
            return pipeline.process(invalid(caller, name.get(), DnsOperation.DELETE,
                    ErrorCode.MISSING_PARAMETER, "type parameter required"));
        }
        if (!RecordTypes.isSupported(type)) {
            return pipeline.process(invalid(caller, name.get(), DnsOperation.DELETE,
                    ErrorCode.INVALID_RECORD, "unsupported record type: " + type));
        }
        RecordChange change = new RecordChange(DnsOperation.DELETE, new DnsRecord(recordId, name.get(), type, null, null));
        return pipeline.process(DnsRequest.change(Surface.API, caller.token(), caller.sourceIp(),
                caller.userAgent(), name.get(), change));
    }

    private PipelineResult change(Caller caller, String domain, DnsOperation operation,
                                  String recordId, String rawBody) {
        Optional<String> name = DomainName.normalize(domain);
        if (name.isEmpty()) {
            return pipeline.process(invalid(caller, domain, operation, ErrorCode.INVALID_HOSTNAME, "invalid domain"));
        }
        if (rawBody == null || rawBody.isBlank()) {
            return pipeline.process(invalid(caller, name.get(), operation,
                    ErrorCode.INVALID_REQUEST, "request body required"));
        }
        RecordRequest body;
        try {
            body = objectMapper.readValue(rawBody, RecordRequest.class);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable record body for {}: {}", name.get(), e.getOriginalMessage());
            return pipeline.process(invalid(caller, name.get(), operation,
                    ErrorCode.INVALID_REQUEST, "malformed JSON body"));
        }
        Optional<String> problem = validate(body);
        if (problem.isPresent()) {
            return pipeline.process(invalid(caller, name.get(), operation, ErrorCode.INVALID_RECORD, problem.get()));
        }
        String destination = canonicalDestination(body);
        RecordChange change = new RecordChange(operation,
                new DnsRecord(recordId, name.get(), body.type(), destination, body.ttl()));
        return pipeline.process(DnsRequest.change(Surface.API, caller.token(), caller.sourceIp(),
                caller.userAgent(), name.get(), change));
    }

    static Optional<String> validate(RecordRequest body) {
        if (body == null) {
            return Optional.of("request body required");
        }
        if (!RecordTypes.isSupported(body.type())) {
            return Optional.of("unsupported record type: " + body.type());
        }
        if (body.destination() == null || body.destination().isBlank()) {
            return Optional.of("destination required");
        }
        if (body.destination().length() > MAX_DESTINATION_LENGTH) {
            return Optional.of("destination too long");
        }
        if (body.ttl() != null && (body.ttl() < MIN_TTL || body.ttl() > MAX_TTL)) {
            return Optional.of("ttl must be between " + MIN_TTL + " and " + MAX_TTL);
        }
        if ("A".equals(body.type()) || "AAAA".equals(body.type())) {
            Optional<InetAddress> address = IpAddresses.parse(body.destination());
            if (address.isEmpty() || IpAddresses.isIpv4(address.get()) != "A".equals(body.type())) {
                return Optional.of("destination is not a valid " + body.type() + " address");
            }
        }
        return Optional.empty();
    }

    private static String canonicalDestination(RecordRequest body) {
        if ("A".equals(body.type()) || "AAAA".equals(body.type())) {
            return IpAddresses.parse(body.destination()).map(IpAddresses::toText).orElse(body.destination());
        }
        return body.destination().trim();
    }

    private static DnsRequest invalid(Caller caller, String target, DnsOperation operation,
                                      ErrorCode error, String detail) {
        return DnsRequest.invalid(Surface.API, caller.token(), caller.sourceIp(), caller.userAgent(),
                target, operation, error, detail);
    }

    /**
     * Who is calling: bearer token, resolved client address and user agent.
     */
    public record Caller(String token, String sourceIp, String userAgent) {
    }
}
