package com.trialmatch.matching;

import com.trialmatch.error.ProviderUnavailableException;

/**
 * A reasoning backend reduced to one capability: prompt in, raw answer text out.
 * Implementations absorb their own response envelope; callers never see it.
 */
public interface ReasoningProvider {

    /**
     * Short identifier used in logs and on {@link com.trialmatch.model.MatchResult#provider()}.
     */
    String name();

    /**
     * @throws ProviderUnavailableException on timeout, non-success status or transport error
     */
    String execute(String prompt);
}
