package com.trialmatch.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void of_shouldFallBackToDefaultsForUnsetKeys() {
        Config config = Config.of(Path.of("/work"), Map.of());

        assertEquals("https://clinicaltrials.gov/api/v2", config.getString("registry.base_url"));
        assertEquals(24, config.getInt("cache.ttl_hours"));
        assertEquals(4, config.getInt("match.concurrency"));
        assertEquals(0.0, config.getDouble("match.min_score"), 1e-9);
        assertTrue(config.getBoolean("registry.recruiting_only", false));
        assertEquals("ollama", config.getString("reasoning.provider"));
    }

    @Test
    void of_shouldLetExplicitValuesOverrideDefaults() {
        Config config = Config.of(Path.of("/work"), Map.of(
                "match.concurrency", "8",
                "registry.recruiting_only", "false",
                "cache.dir", "cache/trials"
        ));

        assertEquals(8, config.getInt("match.concurrency"));
        assertFalse(config.getBoolean("registry.recruiting_only", true));
        assertEquals(Path.of("/work/cache/trials"), config.getPath("cache.dir"));
        assertEquals("override", config.sourceOf("match.concurrency"));
        assertEquals("default", config.sourceOf("match.deadline_sec"));
    }

    @Test
    void getInt_shouldUseFallbackForNonNumericValue() {
        Config config = Config.of(Path.of("."), Map.of("registry.page_size", "lots"));

        assertEquals(50, config.getInt("registry.page_size", 50));
    }

    @Test
    void getBoolean_shouldUseFallbackOnlyForUnknownUnsetKeys() {
        Config config = Config.of(Path.of("."), Map.of());

        assertTrue(config.getBoolean("feature.unknown", true));
        assertTrue(config.getBoolean("cache.enabled", false));
    }

    @Test
    void getList_shouldSplitOnCommaAndSemicolon() {
        Config config = Config.of(Path.of("."), Map.of("registry.keywords", "insulin, metformin;  ; hba1c"));

        assertEquals(List.of("insulin", "metformin", "hba1c"), config.getList("registry.keywords"));
    }

    @Test
    void requireString_shouldThrowWhenMissing() {
        Config config = Config.of(Path.of("."), Map.of());

        assertThrows(IllegalArgumentException.class, () -> config.requireString("anthropic.api_key"));
    }

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMaps() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of(
                "match", Map.of("max_trials", 25, "min_score", 0.5),
                "registry", Map.of("keywords", List.of("insulin", "hba1c"))
        ));

        assertEquals(25, config.getInt("match.max_trials"));
        assertEquals(0.5, config.getDouble("match.min_score"), 1e-9);
        assertEquals("insulin,hba1c", config.getString("registry.keywords"));
    }

    @Test
    void load_shouldApplyWorkingDirectoryOverrides(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "match.deadline_sec=42\nollama.model=mistral\n");

        Config config = Config.load(dir);

        assertEquals(42, config.getInt("match.deadline_sec"));
        assertEquals("mistral", config.getString("ollama.model"));
        assertEquals("override", config.sourceOf("ollama.model"));
        assertEquals("resource", config.sourceOf("match.concurrency"));
    }
}
