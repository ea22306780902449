package com.trialmatch.model;

import com.trialmatch.error.ValidationFailureException;

import java.time.LocalDate;

/**
 * One laboratory observation. The value must be a finite number; a non-numeric
 * value is rejected here, never at matching time.
 */
public record LabResult(String testName, double value, String unit, LocalDate observedOn) {

    public LabResult {
        if (testName == null || testName.isBlank()) {
            throw new ValidationFailureException("lab_results.test_name", "is required");
        }
        if (!Double.isFinite(value)) {
            throw new ValidationFailureException("lab_results.value", "must be a finite number for " + testName.trim());
        }
        if (unit == null || unit.isBlank()) {
            throw new ValidationFailureException("lab_results.unit", "is required for " + testName.trim());
        }
        testName = testName.trim();
        unit = unit.trim();
    }

    /**
     * Parses a raw textual value, as it arrives from a form or a JSON string.
     */
    public static LabResult parse(String testName, String rawValue, String unit, LocalDate observedOn) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new ValidationFailureException("lab_results.value", "is required for " + testName);
        }
        double value;
        try {
            value = Double.parseDouble(rawValue.trim());
        } catch (NumberFormatException e) {
            throw new ValidationFailureException("lab_results.value", "'" + rawValue.trim() + "' is not a number", e);
        }
        return new LabResult(testName, value, unit, observedOn);
    }
}
