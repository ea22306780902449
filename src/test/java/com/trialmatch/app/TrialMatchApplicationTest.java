package com.trialmatch.app;

import com.trialmatch.config.Config;
import com.trialmatch.error.RegistryUnavailableException;
import com.trialmatch.model.Trial;
import com.trialmatch.registry.TrialRegistryClient;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrialMatchApplicationTest {

    @TempDir
    Path dir;

    @Test
    void search_shouldPrintTrialsFromRegistry() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        RecordingRegistry registry = new RecordingRegistry();

        int exit = app(buffer).run(parse("--search", "asthma", "--limit", "3"), config(), registry);

        assertEquals(0, exit);
        assertEquals(List.of("asthma:3"), registry.searches);
        String out = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Found 1 trials"));
        assertTrue(out.contains("NCT03000001  PHASE2  Biologic for Severe Asthma"));
        assertTrue(out.contains("Denver, Colorado"));
    }

    @Test
    void run_shouldReturnUsageErrorForInvalidArguments() throws Exception {
        RecordingRegistry registry = new RecordingRegistry();

        assertEquals(2, app(new ByteArrayOutputStream()).run(parse("--search", "asthma", "--limit", "many"), config(), registry));
        assertEquals(2, app(new ByteArrayOutputStream()).run(parse("--match", "--condition", "asthma"), config(), registry));
        assertEquals(2, app(new ByteArrayOutputStream()).run(parse("--limit", "5"), config(), registry));
        assertTrue(registry.searches.isEmpty());
    }

    @Test
    void run_shouldRejectInvalidPatientFileBeforeMatching() throws Exception {
        Files.writeString(dir.resolve("patient.json"), "{\"age\": 150, \"gender\": \"female\"}");
        RecordingRegistry registry = new RecordingRegistry();

        int exit = app(new ByteArrayOutputStream()).run(
                parse("--match", "--patient", "patient.json", "--condition", "asthma"), config(), registry);

        assertEquals(2, exit);
        assertTrue(registry.searches.isEmpty());
    }

    @Test
    void run_shouldReturnFailureWhenRegistryIsDown() throws Exception {
        TrialRegistryClient down = new TrialRegistryClient() {
            @Override
            public List<Trial> search(String condition, int maxResults) {
                throw new RegistryUnavailableException("registry returned 503");
            }

            @Override
            public Trial getById(String trialId) {
                throw new RegistryUnavailableException("registry returned 503");
            }
        };

        assertEquals(1, app(new ByteArrayOutputStream()).run(parse("--search", "asthma"), config(), down));
    }

    @Test
    void purgeCache_shouldRemoveExpiredEntries() throws Exception {
        Path cacheDir = dir.resolve("trials_cache");
        Files.createDirectories(cacheDir);
        Files.writeString(cacheDir.resolve("stale.json"),
                "{\"key\":\"stale\",\"created_at\":\"2020-01-01T00:00:00Z\",\"trials\":[]}");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int exit = app(buffer).run(parse("--purge-cache"), config(), new RecordingRegistry());

        assertEquals(0, exit);
        assertFalse(Files.exists(cacheDir.resolve("stale.json")));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Removed 1 expired cache entries."));
    }

    private Config config() {
        return Config.of(dir, Map.of());
    }

    private static TrialMatchApplication app(ByteArrayOutputStream buffer) {
        return new TrialMatchApplication(new PrintStream(buffer, true, StandardCharsets.UTF_8), false);
    }

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(TrialMatchApplication.buildOptions(), args);
    }

    private static final class RecordingRegistry implements TrialRegistryClient {
        final List<String> searches = new ArrayList<>();

        @Override
        public List<Trial> search(String condition, int maxResults) {
            searches.add(condition + ":" + maxResults);
            return List.of(Trial.builder()
                    .id("NCT03000001")
                    .title("Biologic for Severe Asthma")
                    .phase("PHASE2")
                    .location("Denver, Colorado")
                    .build());
        }

        @Override
        public Trial getById(String trialId) {
            return search(trialId, 1).get(0);
        }
    }
}
