package com.dnsfilter.api.dns;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(
        String status,
        @JsonProperty("error_code") String errorCode,
        String message) {

    public static ApiError of(String errorCode, String message) {
        return new ApiError("error", errorCode, message);
    }
}
