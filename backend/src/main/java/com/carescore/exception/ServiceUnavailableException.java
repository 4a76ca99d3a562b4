package com.carescore.exception;

import lombok.Getter;

/**
 * A dependency is unusable right now: its circuit is open or retries ran out.
 */
@Getter
public class ServiceUnavailableException extends ClinicalServiceException {

    public static final String CODE = "SERVICE_UNAVAILABLE";

    public static final String CIRCUIT_OPEN = "circuit_open";
    public static final String RETRIES_EXHAUSTED = "retries_exhausted";
    public static final String TIMEOUT = "timeout";
    public static final String NON_TRANSIENT = "non_transient_failure";

    private final String dependency;
    private final String reason;

    public ServiceUnavailableException(String dependency, String reason) {
        this(dependency, reason, null);
    }

    public ServiceUnavailableException(String dependency, String reason, Throwable cause) {
        super(CODE, "Dependency '" + dependency + "' unavailable: " + reason, cause);
        this.dependency = dependency;
        this.reason = reason;
    }
}
