package com.trialmatch.cache;

import com.trialmatch.model.Trial;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A cached search result. Valid only while {@code now - createdAt < ttl}; an expired entry is absent, never partially valid.
 */
public record CacheEntry(String key, List<Trial> trials, Instant createdAt) {

    public CacheEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cache key is required");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt is required");
        }
        trials = trials == null ? List.of() : List.copyOf(trials);
    }

    public boolean isValidAt(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) < 0;
    }
}
