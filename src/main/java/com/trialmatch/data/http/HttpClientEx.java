package com.trialmatch.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin wrapper over {@link HttpClient} shared by the registry client and the local reasoning provider.
 * Non-2xx responses surface as {@link HttpStatusException}; timeouts as {@link java.net.http.HttpTimeoutException}.
 */
public class HttpClientEx {
    private final HttpClient client;
    private final String userAgent;

    public HttpClientEx() {
        this("TrialMatch/1.0");
    }

    /**
     * Builds a client with a 20s connect timeout that follows redirects and sends {@code userAgent}
     * on every request. A blank agent falls back to the default.
     */
    public HttpClientEx(String userAgent) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? "TrialMatch/1.0" : userAgent.trim();
    }

    /**
     * GETs {@code url} expecting JSON and returns the body as text.
     *
     * @throws HttpStatusException on a non-2xx status
     */
    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        return getText(url, timeoutSeconds, Map.of());
    }

    /**
     * GET with extra request headers. Null header names or values are skipped.
     */
    public String getText(String url, int timeoutSeconds, Map<String, String> headers) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("Accept", "application/json")
                .header("User-Agent", userAgent);
        applyHeaders(builder, headers);
        return send(builder.build(), url);
    }

    /**
     * POSTs a JSON body and returns the response body as text.
     *
     * @throws HttpStatusException on a non-2xx status
     */
    public String postJson(String url, String json, int timeoutSeconds) throws IOException, InterruptedException {
        return postJson(url, json, timeoutSeconds, Map.of());
    }

    /**
     * POST with extra request headers. A null body is sent as empty.
     */
    public String postJson(String url, String json, int timeoutSeconds, Map<String, String> headers) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .POST(HttpRequest.BodyPublishers.ofString(json == null ? "" : json, StandardCharsets.UTF_8))
                .header("Content-Type", "application/json")
                .header("User-Agent", userAgent);
        applyHeaders(builder, headers);
        return send(builder.build(), url);
    }

    /**
     * Builds {@code base?k=v&...} skipping null or blank values. Insertion order is kept.
     */
    public static String withQuery(String base, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return base;
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : new LinkedHashMap<>(params).entrySet()) {
            String value = entry.getValue();
            if (value == null || value.isBlank()) {
                continue;
            }
            joiner.add(encode(entry.getKey()) + "=" + encode(value));
        }
        String query = joiner.toString();
        if (query.isEmpty()) {
            return base;
        }
        return base + (base.contains("?") ? "&" : "?") + query;
    }

    /**
     * URL-encodes as UTF-8; null encodes as empty.
     */
    public static String encode(String raw) {
        return URLEncoder.encode(raw == null ? "" : raw, StandardCharsets.UTF_8);
    }

    private String send(HttpRequest request, String url) throws IOException, InterruptedException {
        HttpResponse<String> resp = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new HttpStatusException(resp.statusCode(), url, resp.body());
    }

    private void applyHeaders(HttpRequest.Builder builder, Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey() != null && header.getValue() != null) {
                builder.header(header.getKey(), header.getValue());
            }
        }
    }
}
