package com.trialmatch.model;

import com.trialmatch.error.ValidationFailureException;

public record Medication(String name, String dosage, String frequency) {

    public Medication {
        if (name == null || name.isBlank()) {
            throw new ValidationFailureException("medications.name", "is required");
        }
        name = name.trim();
        dosage = dosage == null || dosage.isBlank() ? null : dosage.trim();
        frequency = frequency == null || frequency.isBlank() ? null : frequency.trim();
    }

    public static Medication of(String name) {
        return new Medication(name, null, null);
    }
}
