package com.carescore.service.scoring;

import com.carescore.exception.ValidationException;

import java.util.Set;
import java.util.TreeSet;

/**
 * Input rule for one category of a tool: either a discrete set of allowed values or an
 * inclusive integer range.
 */
public record CategoryRule(String name, String label, int min, int max, Set<Integer> allowedValues) {

    public static CategoryRule discrete(String name, String label, Integer... values) {
        TreeSet<Integer> allowed = new TreeSet<>(Set.of(values));
        return new CategoryRule(name, label, allowed.first(), allowed.last(), allowed);
    }

    public static CategoryRule range(String name, String label, int min, int max) {
        return new CategoryRule(name, label, min, max, null);
    }

    public void validate(int value) {
        if (allowedValues != null) {
            if (!allowedValues.contains(value)) {
                throw new ValidationException(name, "allowed_values",
                    name + " must be one of " + allowedValues + " but was " + value);
            }
        } else if (value < min || value > max) {
            throw new ValidationException(name, "range",
                name + " must be between " + min + " and " + max + " but was " + value);
        }
    }
}
