package com.trialmatch.error;

/**
 * Root of the matching engine's failure taxonomy.
 */
public abstract class TrialMatchException extends RuntimeException {

    protected TrialMatchException(String message) {
        super(message);
    }

    protected TrialMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
