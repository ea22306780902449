package com.trialmatch.matching;

import com.trialmatch.data.http.HttpClientEx;
import com.trialmatch.error.ProviderUnavailableException;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Local Ollama server over {@code /api/generate}. The answer arrives as the {@code response} field of a document body.
 */
public final class OllamaReasoningProvider implements ReasoningProvider {
    private final HttpClientEx http;
    private final String baseUrl;
    private final String model;
    private final int timeoutSeconds;
    private final int maxTokens;
    private final double temperature;

    public OllamaReasoningProvider(HttpClientEx http, String baseUrl, String model, int timeoutSeconds, int maxTokens, double temperature) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
        this.maxTokens = Math.max(0, maxTokens);
        this.temperature = temperature;
    }

    @Override
    public String name() {
        return "ollama:" + model;
    }

    /**
     * Posts to {@code /api/generate} with streaming off and JSON output requested, and returns the
     * {@code response} field of the reply.
     */
    @Override
    public String execute(String prompt) {
        JSONObject req = new JSONObject();
        req.put("model", model);
        req.put("prompt", prompt == null ? "" : prompt);
        req.put("stream", false);
        req.put("format", "json");
        JSONObject options = new JSONObject();
        options.put("temperature", temperature);
        if (maxTokens > 0) {
            options.put("num_predict", maxTokens);
        }
        req.put("options", options);

        String resp;
        try {
            resp = http.postJson(baseUrl + "/api/generate", req.toString(), timeoutSeconds);
        } catch (HttpTimeoutException e) {
            throw new ProviderUnavailableException(name(), "ollama timed out after " + timeoutSeconds + "s", e);
        } catch (IOException e) {
            throw new ProviderUnavailableException(name(), "ollama unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(name(), "ollama call interrupted", e);
        }

        try {
            JSONObject o = new JSONObject(resp);
            if (o.has("error")) {
                throw new ProviderUnavailableException(name(), "ollama error: " + o.optString("error"));
            }
            if (!o.has("response") || o.isNull("response")) {
                throw new ProviderUnavailableException(name(), "ollama reply has no 'response' field");
            }
            return o.getString("response");
        } catch (JSONException e) {
            throw new ProviderUnavailableException(name(), "ollama reply is not a JSON document: " + e.getMessage(), e);
        }
    }
}
