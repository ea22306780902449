package com.trialmatch.model;

import com.trialmatch.error.ValidationFailureException;

import java.util.Locale;

public enum SmokingStatus {
    NEVER("never"),
    FORMER("former"),
    CURRENT("current");

    private final String label;

    SmokingStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the matching status, or {@code null} for a blank value
     */
    public static SmokingStatus fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (SmokingStatus status : values()) {
            if (status.label.equals(target)) {
                return status;
            }
        }
        throw new ValidationFailureException("smoking_status", "unknown value '" + raw.trim() + "'");
    }
}
