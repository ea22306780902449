package com.trialmatch.registry;

import com.trialmatch.cache.InMemoryCacheStore;
import com.trialmatch.cache.MutableClock;
import com.trialmatch.config.Config;
import com.trialmatch.data.http.HttpClientEx;
import com.trialmatch.data.http.HttpStatusException;
import com.trialmatch.error.RegistryUnavailableException;
import com.trialmatch.error.TrialNotFoundException;
import com.trialmatch.error.ValidationFailureException;
import com.trialmatch.model.Trial;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClinicalTrialsGovClientTest {
    private static final Duration TTL = Duration.ofHours(24);

    @Test
    void search_shouldHitUpstreamOnceWithinTtlAndAgainAfterExpiry() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        ScriptedHttp http = new ScriptedHttp();
        http.respondAlways(page(null, "NCT00000001", "NCT00000002"));
        ClinicalTrialsGovClient client = client(Map.of(), http, clock);

        List<Trial> first = client.search("Diabetes", 10);
        List<Trial> second = client.search("  diabetes ", 10);

        assertEquals(1, http.urls.size());
        assertEquals(first, second);

        clock.advance(TTL.plusSeconds(1));
        client.search("diabetes", 10);

        assertEquals(2, http.urls.size());
    }

    @Test
    void search_shouldSendConditionRecruitingFilterAndPageSize() {
        ScriptedHttp http = new ScriptedHttp();
        http.respondAlways(page(null, "NCT00000001"));
        ClinicalTrialsGovClient client = client(Map.of("registry.keywords", "insulin"), http, new MutableClock(Instant.now()));

        client.search("type 2 diabetes", 7);

        String url = http.urls.get(0);
        assertTrue(url.startsWith("https://clinicaltrials.gov/api/v2/studies?"));
        assertTrue(url.contains("query.cond=type+2+diabetes"));
        assertTrue(url.contains("filter.overallStatus=RECRUITING"));
        assertTrue(url.contains("query.term=insulin"));
        assertTrue(url.contains("pageSize=7"));
        assertTrue(url.contains("format=json"));
    }

    @Test
    void search_shouldOmitStatusFilterWhenRecruitingOnlyDisabled() {
        ScriptedHttp http = new ScriptedHttp();
        http.respondAlways(page(null));
        ClinicalTrialsGovClient client = client(Map.of("registry.recruiting_only", "false"), http, new MutableClock(Instant.now()));

        client.search("asthma", 5);

        assertFalse(http.urls.get(0).contains("filter.overallStatus"));
    }

    @Test
    void search_shouldFollowPageTokensAndDeduplicate() {
        ScriptedHttp http = new ScriptedHttp();
        http.respond(page("tok2", "NCT00000001", "NCT00000002"));
        http.respond(page(null, "NCT00000002", "NCT00000003"));
        ClinicalTrialsGovClient client = client(Map.of("registry.page_size", "2"), http, new MutableClock(Instant.now()));

        List<Trial> trials = client.search("copd", 4);

        assertEquals(List.of("NCT00000001", "NCT00000002", "NCT00000003"), ids(trials));
        assertEquals(2, http.urls.size());
        assertTrue(http.urls.get(1).contains("pageToken=tok2"));
    }

    @Test
    void search_shouldStopAtMaxResults() {
        ScriptedHttp http = new ScriptedHttp();
        http.respondAlways(page("more", "NCT00000001", "NCT00000002", "NCT00000003"));
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        assertEquals(2, client.search("copd", 2).size());
        assertEquals(1, http.urls.size());
    }

    @Test
    void search_shouldCacheEmptyResults() {
        ScriptedHttp http = new ScriptedHttp();
        http.respondAlways(page(null));
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        assertTrue(client.search("very rare syndrome", 10).isEmpty());
        assertTrue(client.search("very rare syndrome", 10).isEmpty());
        assertEquals(1, http.urls.size());
    }

    @Test
    void search_shouldRaiseRegistryUnavailableOnTransportFailure() {
        ScriptedHttp http = new ScriptedHttp();
        http.failWith(new ConnectException("connection refused"));
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        assertThrows(RegistryUnavailableException.class, () -> client.search("asthma", 10));
    }

    @Test
    void search_shouldRaiseRegistryUnavailableOnServerError() {
        ScriptedHttp http = new ScriptedHttp();
        http.failWith(new HttpStatusException(503, "https://clinicaltrials.gov/api/v2/studies", "maintenance"));
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        assertThrows(RegistryUnavailableException.class, () -> client.search("asthma", 10));
    }

    @Test
    void search_shouldRaiseRegistryUnavailableOnMalformedPayload() {
        ScriptedHttp http = new ScriptedHttp();
        http.respond("<html>not json</html>");
        http.respond("{\"totalCount\": 3}");
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        assertThrows(RegistryUnavailableException.class, () -> client.search("asthma", 10));
        assertThrows(RegistryUnavailableException.class, () -> client.search("asthma", 10));
    }

    @Test
    void search_shouldNotCacheFailures() {
        ScriptedHttp http = new ScriptedHttp();
        http.respond("{}");
        http.respond(page(null, "NCT00000009"));
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        assertThrows(RegistryUnavailableException.class, () -> client.search("asthma", 10));
        assertEquals(List.of("NCT00000009"), ids(client.search("asthma", 10)));
    }

    @Test
    void search_shouldValidateBeforeAnyNetworkCall() {
        ScriptedHttp http = new ScriptedHttp();
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        assertThrows(ValidationFailureException.class, () -> client.search("  ", 10));
        assertThrows(ValidationFailureException.class, () -> client.search("asthma", 0));
        assertThrows(ValidationFailureException.class, () -> client.search("asthma", 101));
        assertTrue(http.urls.isEmpty());
    }

    @Test
    void getById_shouldFetchSingleStudyAndCacheIt() {
        ScriptedHttp http = new ScriptedHttp();
        http.respondAlways(study("NCT00000042").toString());
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        Trial first = client.getById("NCT00000042");
        Trial second = client.getById(" NCT00000042 ");

        assertEquals("NCT00000042", first.id);
        assertEquals(first, second);
        assertEquals(1, http.urls.size());
        assertTrue(http.urls.get(0).startsWith("https://clinicaltrials.gov/api/v2/studies/NCT00000042?format=json"));
    }

    @Test
    void getById_shouldMapNotFound() {
        ScriptedHttp http = new ScriptedHttp();
        http.failWith(new HttpStatusException(404, "https://clinicaltrials.gov/api/v2/studies/NCT09999999", ""));
        ClinicalTrialsGovClient client = client(Map.of(), http, new MutableClock(Instant.now()));

        TrialNotFoundException e = assertThrows(TrialNotFoundException.class, () -> client.getById("NCT09999999"));
        assertEquals("NCT09999999", e.trialId());
    }

    private static ClinicalTrialsGovClient client(Map<String, String> values, ScriptedHttp http, MutableClock clock) {
        Config config = Config.of(Path.of("."), values);
        return new ClinicalTrialsGovClient(config, http, new InMemoryCacheStore(TTL, clock), new InMemoryCacheStore(TTL, clock));
    }

    private static List<String> ids(List<Trial> trials) {
        List<String> out = new ArrayList<>();
        for (Trial trial : trials) {
            out.add(trial.id);
        }
        return out;
    }

    static JSONObject study(String id) {
        return new JSONObject().put("protocolSection", new JSONObject()
                .put("identificationModule", new JSONObject().put("nctId", id).put("briefTitle", "Study " + id))
                .put("eligibilityModule", new JSONObject()
                        .put("eligibilityCriteria", "Inclusion Criteria:\n* Adults\nExclusion Criteria:\n* Pregnancy")));
    }

    private static String page(String nextToken, String... ids) {
        JSONArray studies = new JSONArray();
        for (String id : ids) {
            studies.put(study(id));
        }
        JSONObject page = new JSONObject().put("studies", studies);
        if (nextToken != null) {
            page.put("nextPageToken", nextToken);
        }
        return page.toString();
    }

    private static final class ScriptedHttp extends HttpClientEx {
        final List<String> urls = new ArrayList<>();
        private final Deque<String> bodies = new ArrayDeque<>();
        private String always;
        private IOException failure;

        void respond(String body) {
            bodies.add(body);
        }

        void respondAlways(String body) {
            always = body;
        }

        void failWith(IOException failure) {
            this.failure = failure;
        }

        @Override
        public String getText(String url, int timeoutSeconds) throws IOException {
            urls.add(url);
            if (failure != null) {
                throw failure;
            }
            if (!bodies.isEmpty()) {
                return bodies.poll();
            }
            if (always != null) {
                return always;
            }
            throw new IOException("no scripted response for " + url);
        }
    }
}
