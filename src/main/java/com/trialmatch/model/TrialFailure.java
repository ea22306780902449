package com.trialmatch.model;

/**
 * A candidate trial that could not be evaluated in a match request.
 */
public record TrialFailure(String trialId, Kind kind, String message) {

    public enum Kind {
        PROVIDER_UNAVAILABLE,
        PARSE_FAILURE,
        DEADLINE_EXCEEDED
    }

    public TrialFailure {
        trialId = trialId == null ? "" : trialId;
        kind = kind == null ? Kind.PROVIDER_UNAVAILABLE : kind;
        message = message == null ? "" : message;
    }
}
