package com.trialmatch.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheKeysTest {

    @Test
    void searchKey_shouldIgnoreCaseAndWhitespaceOfCondition() {
        Map<String, String> filters = Map.of("filter.overallStatus", "RECRUITING");

        assertEquals(
                CacheKeys.searchKey("Diabetes", filters, 10),
                CacheKeys.searchKey("  diabetes ", filters, 10)
        );
        assertEquals(
                CacheKeys.searchKey("Type 2 Diabetes", filters, 10),
                CacheKeys.searchKey("type  2\tdiabetes", filters, 10)
        );
    }

    @Test
    void searchKey_shouldIgnoreFilterOrder() {
        Map<String, String> a = new LinkedHashMap<>();
        a.put("filter.overallStatus", "RECRUITING");
        a.put("query.term", "insulin");
        Map<String, String> b = new LinkedHashMap<>();
        b.put("query.term", "insulin");
        b.put("filter.overallStatus", "RECRUITING");

        assertEquals(CacheKeys.searchKey("asthma", a, 5), CacheKeys.searchKey("asthma", b, 5));
    }

    @Test
    void searchKey_shouldDifferWhenLimitOrFiltersDiffer() {
        String base = CacheKeys.searchKey("asthma", Map.of(), 5);

        assertNotEquals(base, CacheKeys.searchKey("asthma", Map.of(), 6));
        assertNotEquals(base, CacheKeys.searchKey("asthma", Map.of("filter.overallStatus", "RECRUITING"), 5));
        assertNotEquals(base, CacheKeys.searchKey("copd", Map.of(), 5));
    }

    @Test
    void keys_shouldBeFileSafeTokens() {
        assertTrue(CacheKeys.searchKey("Crohn's disease / colitis", Map.of(), 10).matches("[0-9a-f]{64}"));
        assertTrue(CacheKeys.trialKey("NCT01234567").matches("[0-9a-f]{64}"));
        assertNotEquals(CacheKeys.trialKey("NCT01234567"), CacheKeys.searchKey("NCT01234567", Map.of(), 1));
    }
}
