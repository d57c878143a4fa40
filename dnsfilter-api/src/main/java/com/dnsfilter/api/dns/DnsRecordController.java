package com.dnsfilter.api.dns;

import com.dnsfilter.api.audit.AuditWriteException;
import com.dnsfilter.api.auth.BearerTokens;
import com.dnsfilter.api.backend.DnsRecord;
import com.dnsfilter.api.error.ErrorCode;
import com.dnsfilter.api.pipeline.PipelineResult;
import com.dnsfilter.api.web.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Generic DNS record API for realm tokens.
 *
 * Bodies and parameters are bound leniently and parsed by the service, so a
 * malformed call is still authenticated and audited before it is rejected.
 */
@RestController
@RequestMapping("/api")
public class DnsRecordController {

    private final DnsRecordService recordService;
    private final ClientIpResolver clientIpResolver;

    public DnsRecordController(DnsRecordService recordService, ClientIpResolver clientIpResolver) {
        this.recordService = recordService;
        this.clientIpResolver = clientIpResolver;
    }

    @GetMapping("/dns/{domain}/records")
    public ResponseEntity<?> listRecords(@PathVariable String domain, HttpServletRequest request) {
        PipelineResult result = recordService.listRecords(caller(request), domain);
        return toResponse(result, domain, HttpStatus.OK);
    }

    @PostMapping("/dns/{domain}/records")
    public ResponseEntity<?> createRecord(
            @PathVariable String domain,
            @RequestBody(required = false) String body,
            HttpServletRequest request) {
        PipelineResult result = recordService.createRecord(caller(request), domain, body);
        return toResponse(result, domain, HttpStatus.CREATED);
    }

    @PutMapping("/dns/{domain}/records/{recordId}")
    public ResponseEntity<?> updateRecord(
            @PathVariable String domain,
            @PathVariable String recordId,
            @RequestBody(required = false) String body,
            HttpServletRequest request) {
        PipelineResult result = recordService.updateRecord(caller(request), domain, recordId, body);
        return toResponse(result, domain, HttpStatus.OK);
    }

    @DeleteMapping("/dns/{domain}/records/{recordId}")
    public ResponseEntity<?> deleteRecord(
            @PathVariable String domain,
            @PathVariable String recordId,
            @RequestParam(required = false) String type,
            HttpServletRequest request) {
        PipelineResult result = recordService.deleteRecord(caller(request), domain, recordId, type);
        return toResponse(result, domain, HttpStatus.OK);
    }

    /**
     * Echoes the address this service sees for the caller.
     */
    @GetMapping("/myip")
    public ResponseEntity<MyIpResponse> myIp(HttpServletRequest request) {
        return ResponseEntity.ok(new MyIpResponse(clientIpResolver.resolve(request)));
    }

    private DnsRecordService.Caller caller(HttpServletRequest request) {
        return new DnsRecordService.Caller(
                BearerTokens.extract(request.getHeader(HttpHeaders.AUTHORIZATION)),
                clientIpResolver.resolve(request),
                request.getHeader(HttpHeaders.USER_AGENT));
    }

    private static ResponseEntity<?> toResponse(PipelineResult result, String domain, HttpStatus successStatus) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus)
                    .body(new RecordsResponse("success", domain, result.records()));
        }
        ErrorCode code = result.errorCode();
        return ResponseEntity.status(result.httpStatus())
                .body(ApiError.of(code.publicCode(), messageFor(code)));
    }

    private static String messageFor(ErrorCode code) {
        return switch (code.category()) {
            case AUTHENTICATION -> "Invalid or missing token";
            case AUTHORIZATION -> "Operation not permitted for this token";
            case VALIDATION -> "Invalid request";
            case BACKEND -> "DNS backend error";
            case RATE_LIMITED -> "Too many requests";
            case DISABLED -> "Service disabled";
            case INTERNAL -> "Internal error";
        };
    }

    @ExceptionHandler(AuditWriteException.class)
    public ResponseEntity<ApiError> handleAuditFailure(AuditWriteException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR.publicCode(), "Internal error"));
    }

    public record RecordsResponse(String status, String domain, List<DnsRecord> records) {}

    public record MyIpResponse(String ip) {}
}
