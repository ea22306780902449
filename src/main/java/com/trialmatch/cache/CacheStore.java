package com.trialmatch.cache;

import com.trialmatch.model.Trial;

import java.util.List;
import java.util.Optional;

/**
 * Time-bounded store of trial search results, keyed by {@link CacheKeys}.
 * Concurrent {@code get}/{@code put} on one key never expose a partial entry; the last writer wins.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * @return the entry for {@code key}, or empty when it is missing or expired
     */
    Optional<CacheEntry> get(String key);

    /**
     * Stores {@code trials} under {@code key}, replacing any previous entry.
     */
    void put(String key, List<Trial> trials);

    /**
     * Drops every expired entry.
     *
     * @return number of entries removed
     */
    int invalidateExpired();

    @Override
    default void close() {
    }
}
