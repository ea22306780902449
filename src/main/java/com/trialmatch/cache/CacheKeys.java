package com.trialmatch.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache key derivation. Queries differing only in case or whitespace of the
 * condition, or in the order of their filters, map to the same key.
 */
public final class CacheKeys {
    private CacheKeys() {
    }

    public static String searchKey(String condition, Map<String, String> filters, int limit) {
        StringBuilder canonical = new StringBuilder(128);
        canonical.append("search|condition=").append(normalizeText(condition));
        canonical.append("|limit=").append(limit);
        TreeMap<String, String> sorted = new TreeMap<>();
        if (filters != null) {
            for (Map.Entry<String, String> entry : filters.entrySet()) {
                String name = normalizeText(entry.getKey());
                String value = normalizeText(entry.getValue());
                if (!name.isEmpty() && !value.isEmpty()) {
                    sorted.put(name, value);
                }
            }
        }
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            canonical.append('|').append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sha256(canonical.toString());
    }

    public static String trialKey(String trialId) {
        return sha256("trial|id=" + normalizeText(trialId));
    }

    static String normalizeText(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
