package com.carescore.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a facade call: either data or an error, never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceResult<T>(boolean success, T data, ServiceError error) {

    public static <T> ServiceResult<T> ok(T data) {
        return new ServiceResult<>(true, data, null);
    }

    public static <T> ServiceResult<T> failure(ServiceError error) {
        return new ServiceResult<>(false, null, error);
    }
}
