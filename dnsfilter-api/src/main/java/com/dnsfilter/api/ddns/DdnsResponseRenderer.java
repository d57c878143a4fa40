package com.dnsfilter.api.ddns;

import com.dnsfilter.api.pipeline.PipelineResult;
import org.springframework.stereotype.Component;

/**
 * Maps pipeline outcomes to the exact plain-text bodies DDNS clients parse.
 * No internal detail ever reaches the body.
 */
@Component
public class DdnsResponseRenderer {

    public DdnsResponse render(DdnsProtocol protocol, PipelineResult result, String ip) {
        return render(protocol, classify(result), ip);
    }

    public DdnsResponse render(DdnsProtocol protocol, DdnsCondition condition, String ip) {
        String body = switch (condition) {
            case UPDATED -> "good " + ip;
            case UNCHANGED -> "nochg " + ip;
            case AUTH_FAILED -> "badauth";
            case NOT_YOURS -> protocol.deniedToken();
            case MALFORMED -> protocol.malformedToken();
            case DNS_ERROR -> "dnserr";
            case ABUSE -> "abuse";
            case INTERNAL_FAULT, DISABLED -> "911";
        };
        return new DdnsResponse(condition.httpStatus(), body);
    }

    public DdnsCondition classify(PipelineResult result) {
        if (result.isSuccess()) {
            return result.changed() ? DdnsCondition.UPDATED : DdnsCondition.UNCHANGED;
        }
        return switch (result.errorCode().category()) {
            case AUTHENTICATION -> DdnsCondition.AUTH_FAILED;
            case AUTHORIZATION -> DdnsCondition.NOT_YOURS;
            case VALIDATION -> DdnsCondition.MALFORMED;
            case BACKEND -> DdnsCondition.DNS_ERROR;
            case RATE_LIMITED -> DdnsCondition.ABUSE;
            case DISABLED -> DdnsCondition.DISABLED;
            case INTERNAL -> DdnsCondition.INTERNAL_FAULT;
        };
    }
}
