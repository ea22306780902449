package com.trialmatch.registry;

import com.trialmatch.error.RegistryUnavailableException;
import com.trialmatch.error.TrialNotFoundException;
import com.trialmatch.model.Trial;

import java.util.List;

/**
 * Read access to a trial registry.
 */
public interface TrialRegistryClient {

    /**
     * Trials for a free-text condition, in the registry's relevance order, at most {@code maxResults}.
     * An empty list means the registry found nothing.
     *
     * @throws RegistryUnavailableException when the registry could not be queried
     */
    List<Trial> search(String condition, int maxResults);

    /**
     * @throws TrialNotFoundException when the registry has no trial with that identifier
     * @throws RegistryUnavailableException when the registry could not be queried
     */
    Trial getById(String trialId);
}
