package com.carescore.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned by every controller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String code,
    String error,
    String field,
    Long retryAfterSeconds
) {}
