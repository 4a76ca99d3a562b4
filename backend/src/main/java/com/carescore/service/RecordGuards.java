package com.carescore.service;

import com.carescore.exception.StaleVersionException;
import com.carescore.exception.ValidationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Locale;
import java.util.Set;

/**
 * Checks shared by the facade services.
 */
final class RecordGuards {

    static final int MAX_PAGE_SIZE = 100;

    private RecordGuards() {
    }

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ValidationException.required(field);
        }
    }

    /**
     * Optimistic check: only enforced when the caller sent the version it edited.
     */
    static void checkVersion(String recordId, Long expectedVersion, long actualVersion) {
        if (expectedVersion != null && expectedVersion != actualVersion) {
            throw new StaleVersionException(recordId, expectedVersion, actualVersion);
        }
    }

    /**
     * Builds a page request from "property" or "property,asc|desc".
     */
    static Pageable pageRequest(int page, int size, String sort, Set<String> sortable, String defaultProperty) {
        if (page < 0) {
            throw new ValidationException("page", "range", "page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("limit", "range", "limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        String property = defaultProperty;
        Sort.Direction direction = Sort.Direction.DESC;
        if (sort != null && !sort.isBlank()) {
            String[] parts = sort.split(",");
            property = parts[0].trim();
            if (parts.length > 1) {
                String dir = parts[1].trim().toUpperCase(Locale.ROOT);
                if (!dir.equals("ASC") && !dir.equals("DESC")) {
                    throw new ValidationException("sort", "allowed_values", "sort direction must be asc or desc");
                }
                direction = Sort.Direction.valueOf(dir);
            }
        }
        if (!sortable.contains(property)) {
            throw new ValidationException("sort", "allowed_values", "Cannot sort by '" + property + "'");
        }
        return PageRequest.of(page, size, Sort.by(direction, property));
    }
}
