package com.trialmatch.error;

/**
 * Malformed patient or request input. Raised before any network call is made.
 */
public class ValidationFailureException extends TrialMatchException {
    private final String field;

    public ValidationFailureException(String field, String message) {
        super(field == null || field.isBlank() ? message : field + ": " + message);
        this.field = field == null ? "" : field;
    }

    public ValidationFailureException(String field, String message, Throwable cause) {
        super(field == null || field.isBlank() ? message : field + ": " + message, cause);
        this.field = field == null ? "" : field;
    }

    public String field() {
        return field;
    }
}
