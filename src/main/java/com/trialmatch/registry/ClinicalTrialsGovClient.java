package com.trialmatch.registry;

import com.trialmatch.cache.CacheEntry;
import com.trialmatch.cache.CacheKeys;
import com.trialmatch.cache.CacheStore;
import com.trialmatch.config.Config;
import com.trialmatch.data.http.HttpClientEx;
import com.trialmatch.data.http.HttpStatusException;
import com.trialmatch.error.RegistryUnavailableException;
import com.trialmatch.error.TrialNotFoundException;
import com.trialmatch.error.ValidationFailureException;
import com.trialmatch.model.Trial;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ClinicalTrials.gov API v2 client. Search results are served from the {@link CacheStore}
 * while fresh; single-trial lookups use their own store and never touch search entries.
 */
public final class ClinicalTrialsGovClient implements TrialRegistryClient {
    private static final Logger LOG = LogManager.getLogger(ClinicalTrialsGovClient.class);
    public static final int MAX_RESULTS_LIMIT = 100;

    private final HttpClientEx http;
    private final CacheStore searchCache;
    private final CacheStore trialCache;
    private final StudyParser parser;
    private final String baseUrl;
    private final int timeoutSec;
    private final int pageSize;
    private final boolean recruitingOnly;
    private final String keywords;

    public ClinicalTrialsGovClient(Config config, HttpClientEx http, CacheStore searchCache, CacheStore trialCache) {
        this.http = http;
        this.searchCache = searchCache;
        this.trialCache = trialCache;
        this.parser = new StudyParser(config.getInt("registry.max_locations", 5));
        this.baseUrl = trimTrailingSlash(config.getString("registry.base_url", "https://clinicaltrials.gov/api/v2"));
        this.timeoutSec = Math.max(5, config.getInt("registry.timeout_sec", 30));
        this.pageSize = Math.max(1, Math.min(1000, config.getInt("registry.page_size", 100)));
        this.recruitingOnly = config.getBoolean("registry.recruiting_only", true);
        this.keywords = config.getString("registry.keywords", "");
    }

    /**
     * Serves from the search cache when a fresh entry exists; otherwise follows page tokens until
     * {@code maxResults} distinct trials are collected or the registry runs out, then caches the
     * result, empty results included. Failed fetches are never cached.
     */
    @Override
    public List<Trial> search(String condition, int maxResults) {
        if (condition == null || condition.isBlank()) {
            throw new ValidationFailureException("condition", "is required");
        }
        if (maxResults < 1 || maxResults > MAX_RESULTS_LIMIT) {
            throw new ValidationFailureException("max_results", "must be between 1 and " + MAX_RESULTS_LIMIT + ", got " + maxResults);
        }
        Map<String, String> filters = filters();
        String key = CacheKeys.searchKey(condition, filters, maxResults);
        if (searchCache != null) {
            Optional<CacheEntry> cached = searchCache.get(key);
            if (cached.isPresent()) {
                LOG.info("registry cache hit condition='{}' trials={}", condition.trim(), cached.get().trials().size());
                return cached.get().trials();
            }
        }

        LOG.info("registry cache miss condition='{}' max_results={}, fetching", condition.trim(), maxResults);
        List<Trial> trials = fetchSearch(condition.trim(), maxResults, filters);
        if (searchCache != null) {
            searchCache.put(key, trials);
        }
        return trials;
    }

    /**
     * Fetches one study by NCT identifier through the per-trial cache. A 404 becomes
     * {@link com.trialmatch.error.TrialNotFoundException}.
     */
    @Override
    public Trial getById(String trialId) {
        if (trialId == null || trialId.isBlank()) {
            throw new ValidationFailureException("trial_id", "is required");
        }
        String id = trialId.trim();
        String key = CacheKeys.trialKey(id);
        if (trialCache != null) {
            Optional<CacheEntry> cached = trialCache.get(key);
            if (cached.isPresent() && !cached.get().trials().isEmpty()) {
                return cached.get().trials().get(0);
            }
        }

        String url = HttpClientEx.withQuery(baseUrl + "/studies/" + HttpClientEx.encode(id), Map.of("format", "json"));
        String body;
        try {
            body = http.getText(url, timeoutSec);
        } catch (HttpStatusException e) {
            if (e.isNotFound()) {
                throw new TrialNotFoundException(id);
            }
            throw new RegistryUnavailableException("registry lookup failed for " + id + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RegistryUnavailableException("registry lookup failed for " + id + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException("registry lookup interrupted for " + id, e);
        }

        Trial trial;
        try {
            JSONObject root = new JSONObject(body);
            JSONObject study = root;
            JSONArray studies = root.optJSONArray("studies");
            if (studies != null) {
                if (studies.isEmpty()) {
                    throw new TrialNotFoundException(id);
                }
                study = studies.getJSONObject(0);
            }
            trial = parser.parse(study);
        } catch (JSONException e) {
            throw new RegistryUnavailableException("malformed registry payload for " + id + ": " + e.getMessage(), e);
        }
        if (trial == null) {
            throw new TrialNotFoundException(id);
        }
        if (trialCache != null) {
            trialCache.put(key, List.of(trial));
        }
        return trial;
    }

    private List<Trial> fetchSearch(String condition, int maxResults, Map<String, String> filters) {
        Set<String> seen = new LinkedHashSet<>();
        List<Trial> out = new ArrayList<>(maxResults);
        String pageToken = null;
        int pages = 0;
        int maxPages = (maxResults + pageSize - 1) / pageSize + 1;
        do {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("format", "json");
            params.put("query.cond", condition);
            params.putAll(filters);
            params.put("pageSize", String.valueOf(Math.min(pageSize, maxResults - out.size())));
            params.put("pageToken", pageToken);
            String url = HttpClientEx.withQuery(baseUrl + "/studies", params);

            JSONObject page = fetchPage(url);
            JSONArray studies = page.optJSONArray("studies");
            if (studies == null) {
                throw new RegistryUnavailableException("malformed registry payload: missing 'studies' array");
            }
            for (int i = 0; i < studies.length() && out.size() < maxResults; i++) {
                JSONObject study = studies.optJSONObject(i);
                if (study == null) {
                    continue;
                }
                Trial trial;
                try {
                    trial = parser.parse(study);
                } catch (JSONException e) {
                    LOG.warn("skipping unparseable study at index {}: {}", i, e.getMessage());
                    continue;
                }
                if (trial != null && seen.add(trial.id)) {
                    out.add(trial);
                }
            }
            pages++;
            String next = page.optString("nextPageToken", "");
            pageToken = next.isBlank() ? null : next;
        } while (pageToken != null && out.size() < maxResults && pages < maxPages);

        LOG.info("registry fetched condition='{}' pages={} trials={}", condition, pages, out.size());
        return List.copyOf(out);
    }

    private JSONObject fetchPage(String url) {
        String body;
        try {
            body = http.getText(url, timeoutSec);
        } catch (IOException e) {
            throw new RegistryUnavailableException("registry search failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException("registry search interrupted", e);
        }
        try {
            return new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            throw new RegistryUnavailableException("malformed registry payload: " + e.getMessage(), e);
        }
    }

    private Map<String, String> filters() {
        Map<String, String> filters = new LinkedHashMap<>();
        if (recruitingOnly) {
            filters.put("filter.overallStatus", "RECRUITING");
        }
        if (!keywords.isBlank()) {
            filters.put("query.term", keywords);
        }
        return filters;
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url == null ? "" : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
