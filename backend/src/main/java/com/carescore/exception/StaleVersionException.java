package com.carescore.exception;

import lombok.Getter;

/**
 * The caller edited an older version of the record than the one stored.
 */
@Getter
public class StaleVersionException extends ClinicalServiceException {

    public static final String CODE = "STALE_VERSION";

    private final long expected;
    private final long actual;

    public StaleVersionException(String recordId, long expected, long actual) {
        super(CODE, "Record " + recordId + " is at version " + actual + ", request expected " + expected);
        this.expected = expected;
        this.actual = actual;
    }
}
