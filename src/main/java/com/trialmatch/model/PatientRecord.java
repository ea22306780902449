package com.trialmatch.model;

import com.trialmatch.error.ValidationFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured patient data for a single match request. Immutable; never persisted.
 * {@code smokingStatus} and {@code pregnant} are optional and {@code null} when unknown.
 */
public record PatientRecord(
        int age,
        Gender gender,
        SmokingStatus smokingStatus,
        Boolean pregnant,
        List<Condition> conditions,
        List<Medication> medications,
        List<LabResult> labResults
) {
    public static final int MAX_AGE = 120;

    public PatientRecord {
        if (age < 0 || age > MAX_AGE) {
            throw new ValidationFailureException("age", "must be between 0 and " + MAX_AGE + ", got " + age);
        }
        if (gender == null) {
            throw new ValidationFailureException("gender", "is required");
        }
        if (Boolean.TRUE.equals(pregnant) && gender == Gender.MALE) {
            throw new ValidationFailureException("pregnancy_status", "cannot be true for a male patient");
        }
        conditions = copyOf("conditions", conditions);
        medications = copyOf("medications", medications);
        labResults = copyOf("lab_results", labResults);
    }

    /**
     * The pregnancy flag is only meaningful for female patients.
     */
    public boolean hasPregnancyStatus() {
        return pregnant != null && gender == Gender.FEMALE;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <T> List<T> copyOf(String field, List<T> values) {
        if (values == null) {
            return List.of();
        }
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new ValidationFailureException(field, "must not contain null entries");
        }
        return List.copyOf(values);
    }

    public static final class Builder {
        private int age;
        private Gender gender;
        private SmokingStatus smokingStatus;
        private Boolean pregnant;
        private final ArrayList<Condition> conditions = new ArrayList<>();
        private final ArrayList<Medication> medications = new ArrayList<>();
        private final ArrayList<LabResult> labResults = new ArrayList<>();

        private Builder() {
        }

        public Builder age(int age) {
            this.age = age;
            return this;
        }

        public Builder gender(Gender gender) {
            this.gender = gender;
            return this;
        }

        public Builder smokingStatus(SmokingStatus smokingStatus) {
            this.smokingStatus = smokingStatus;
            return this;
        }

        public Builder pregnant(Boolean pregnant) {
            this.pregnant = pregnant;
            return this;
        }

        public Builder condition(Condition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder medication(Medication medication) {
            this.medications.add(medication);
            return this;
        }

        public Builder labResult(LabResult labResult) {
            this.labResults.add(labResult);
            return this;
        }

        public PatientRecord build() {
            return new PatientRecord(age, gender, smokingStatus, pregnant, conditions, medications, labResults);
        }
    }
}
