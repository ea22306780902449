package com.trialmatch.model;

import com.trialmatch.error.ValidationFailureException;

import java.util.Locale;

public enum Gender {
    MALE("male"),
    FEMALE("female"),
    OTHER("other");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Gender fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new ValidationFailureException("gender", "is required");
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (Gender gender : values()) {
            if (gender.label.equals(target)) {
                return gender;
            }
        }
        throw new ValidationFailureException("gender", "unknown value '" + raw.trim() + "'");
    }
}
