package com.dnsfilter.api.ddns;

import com.dnsfilter.api.audit.AuditWriteException;
import com.dnsfilter.api.auth.BearerTokens;
import com.dnsfilter.api.web.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * DynDNS2 and No-IP compatible update endpoints.
 *
 * Parameters are accepted from the query string or a form body; the token
 * comes from a bearer Authorization header.
 */
@RestController
public class DdnsController {

    private final DdnsUpdateService updateService;
    private final ClientIpResolver clientIpResolver;

    public DdnsController(DdnsUpdateService updateService, ClientIpResolver clientIpResolver) {
        this.updateService = updateService;
        this.clientIpResolver = clientIpResolver;
    }

    @RequestMapping(value = {"/api/ddns/dyndns2/update", "/nic/update"},
            method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<String> dyndns2(
            @RequestParam(required = false) String hostname,
            @RequestParam(required = false) String myip,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest request) {
        return handle(DdnsProtocol.DYNDNS2, hostname, myip, authorization, request);
    }

    @RequestMapping(value = "/api/ddns/noip/update",
            method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<String> noip(
            @RequestParam(required = false) String hostname,
            @RequestParam(required = false) String myip,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest request) {
        return handle(DdnsProtocol.NOIP, hostname, myip, authorization, request);
    }

    private ResponseEntity<String> handle(DdnsProtocol protocol, String hostname, String myip,
                                          String authorization, HttpServletRequest request) {
        DdnsResponse response = updateService.update(
                protocol,
                BearerTokens.extract(authorization),
                hostname,
                myip,
                clientIpResolver.resolve(request),
                request.getHeader(HttpHeaders.USER_AGENT));
        return plainText(response.httpStatus(), response.body());
    }

    @ExceptionHandler(AuditWriteException.class)
    public ResponseEntity<String> handleAuditFailure(AuditWriteException e) {
        return plainText(HttpStatus.INTERNAL_SERVER_ERROR.value(), "911");
    }

    private static ResponseEntity<String> plainText(int status, String body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(body);
    }
}
