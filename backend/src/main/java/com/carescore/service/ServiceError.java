package com.carescore.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Caller-facing error. {@code field} is set for validation failures,
 * {@code retryAfterSeconds} for rate limiting.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceError(String code, String message, String field, Long retryAfterSeconds) {

    public static ServiceError of(String code, String message) {
        return new ServiceError(code, message, null, null);
    }
}
