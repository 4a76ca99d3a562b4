package com.carescore.dto.response;

import java.util.List;

/**
 * One page of a listing.
 */
public record PageDto<T>(
    List<T> items,
    int page,
    int size,
    long totalItems,
    int totalPages
) {}
