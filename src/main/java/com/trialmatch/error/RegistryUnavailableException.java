package com.trialmatch.error;

/**
 * The trial registry could not be queried: transport error, non-success status or an unreadable payload.
 * Distinct from a search that legitimately found zero trials.
 */
public class RegistryUnavailableException extends TrialMatchException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
