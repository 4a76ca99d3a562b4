package com.carescore.exception;

import lombok.Getter;

/**
 * Malformed or out-of-range input. Surfaced immediately and never retried.
 */
@Getter
public class ValidationException extends ClinicalServiceException {

    public static final String CODE = "VALIDATION_FAILURE";

    private final String field;

    /**
     * Kind of rule that failed, e.g. "required", "range", "allowed_values".
     */
    private final String validationType;

    public ValidationException(String field, String validationType, String message) {
        super(CODE, message);
        this.field = field;
        this.validationType = validationType;
    }

    public static ValidationException required(String field) {
        return new ValidationException(field, "required", field + " is required");
    }
}
