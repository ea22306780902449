package com.trialmatch.cache;

import com.trialmatch.model.Trial;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache store. Entries do not survive a restart.
 */
public final class InMemoryCacheStore implements CacheStore {
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryCacheStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isValidAt(clock.instant(), ttl)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(String key, List<Trial> trials) {
        entries.put(key, new CacheEntry(key, trials, clock.instant()));
    }

    @Override
    public int invalidateExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (!it.next().getValue().isValidAt(now, ttl)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void close() {
        entries.clear();
    }
}
