package com.trialmatch.model;

import com.trialmatch.error.ValidationFailureException;

import java.time.LocalDate;

/**
 * A diagnosed condition. {@code code} is an ICD-10 style classification; code and onset are optional.
 */
public record Condition(String name, String code, LocalDate onsetDate) {

    public Condition {
        if (name == null || name.isBlank()) {
            throw new ValidationFailureException("conditions.name", "is required");
        }
        name = name.trim();
        code = code == null || code.isBlank() ? null : code.trim();
    }

    public static Condition of(String name) {
        return new Condition(name, null, null);
    }
}
