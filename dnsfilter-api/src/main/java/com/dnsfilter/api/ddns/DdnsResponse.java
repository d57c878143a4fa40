package com.dnsfilter.api.ddns;

public record DdnsResponse(int httpStatus, String body) {
}
