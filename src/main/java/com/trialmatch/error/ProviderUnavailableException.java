package com.trialmatch.error;

/**
 * The reasoning backend timed out, answered with a non-success status, or could not be reached.
 */
public class ProviderUnavailableException extends TrialMatchException {
    private final String provider;

    public ProviderUnavailableException(String provider, String message) {
        super(message);
        this.provider = provider == null ? "" : provider;
    }

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider == null ? "" : provider;
    }

    public String provider() {
        return provider;
    }
}
