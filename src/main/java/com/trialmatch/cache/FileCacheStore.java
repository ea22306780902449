package com.trialmatch.cache;

import com.trialmatch.model.Trial;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * One JSON file per key under a cache directory, so entries survive restarts.
 * Writes go to a temp file that is atomically renamed over the target; a reader
 * sees either the old entry or the new one.
 */
public final class FileCacheStore implements CacheStore {
    private static final Logger LOG = LogManager.getLogger(FileCacheStore.class);
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final Duration ttl;
    private final Clock clock;

    public FileCacheStore(Path dir, Duration ttl, Clock clock) {
        this.dir = dir;
        this.ttl = ttl;
        this.clock = clock;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create cache dir " + dir, e);
        }
    }

    public Path dir() {
        return dir;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        Path file = fileFor(key);
        Optional<CacheEntry> entry = read(file);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (!entry.get().isValidAt(clock.instant(), ttl)) {
            LOG.debug("cache expired key={}", key);
            return Optional.empty();
        }
        return entry;
    }

    @Override
    public void put(String key, List<Trial> trials) {
        JSONObject doc = new JSONObject();
        doc.put("key", key);
        doc.put("created_at", clock.instant().toString());
        doc.put("trials", TrialJson.toJsonArray(trials == null ? List.of() : trials));
        Path target = fileFor(key);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, key, ".tmp");
            Files.writeString(tmp, doc.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.info("cache stored key={} trials={}", key, trials == null ? 0 : trials.size());
        } catch (IOException e) {
            LOG.warn("cache write failed key={}: {}", key, e.getMessage());
            deleteQuietly(tmp);
        }
    }

    @Override
    public int invalidateExpired() {
        Instant now = clock.instant();
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                Optional<CacheEntry> entry = read(file);
                if (entry.isEmpty() || !entry.get().isValidAt(now, ttl)) {
                    if (deleteQuietly(file)) {
                        removed++;
                    }
                }
            }
        } catch (IOException e) {
            LOG.warn("cache sweep failed dir={}: {}", dir, e.getMessage());
        }
        LOG.info("cache sweep removed={} dir={}", removed, dir);
        return removed;
    }

    private Optional<CacheEntry> read(Path file) {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("cache read failed file={}: {}", file, e.getMessage());
            return Optional.empty();
        }
        try {
            JSONObject doc = new JSONObject(raw);
            Instant createdAt = Instant.parse(doc.getString("created_at"));
            List<Trial> trials = TrialJson.fromJsonArray(doc.getJSONArray("trials"));
            return Optional.of(new CacheEntry(doc.getString("key"), trials, createdAt));
        } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
            LOG.warn("cache entry unreadable, treating as absent file={}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Path fileFor(String key) {
        if (key == null || !key.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("cache key must be a file-safe token: " + key);
        }
        return dir.resolve(key + SUFFIX);
    }

    private boolean deleteQuietly(Path file) {
        if (file == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("cache delete failed file={}: {}", file, e.getMessage());
            return false;
        }
    }
}
