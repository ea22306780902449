package com.trialmatch.error;

public class TrialNotFoundException extends TrialMatchException {
    private final String trialId;

    public TrialNotFoundException(String trialId) {
        super("trial not found: " + trialId);
        this.trialId = trialId;
    }

    public String trialId() {
        return trialId;
    }
}
