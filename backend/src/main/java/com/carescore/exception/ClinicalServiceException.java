package com.carescore.exception;

import lombok.Getter;

/**
 * Base class for failures the service facade knows how to report to callers.
 */
@Getter
public class ClinicalServiceException extends RuntimeException {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String code;
    private final ErrorSeverity severity;

    public ClinicalServiceException(String code, String message) {
        this(code, message, null);
    }

    public ClinicalServiceException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.severity = ErrorSeverity.forCode(code);
    }
}
