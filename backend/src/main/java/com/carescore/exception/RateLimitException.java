package com.carescore.exception;

import lombok.Getter;

@Getter
public class RateLimitException extends ClinicalServiceException {

    public static final String CODE = "RATE_LIMIT_EXCEEDED";

    private final long retryAfterSeconds;

    public RateLimitException(long retryAfterSeconds) {
        super(CODE, "Rate limit exceeded, retry after " + retryAfterSeconds + "s");
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
