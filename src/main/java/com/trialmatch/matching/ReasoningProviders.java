package com.trialmatch.matching;

import com.trialmatch.config.Config;
import com.trialmatch.data.http.HttpClientEx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Resolves the configured {@link ReasoningProvider} once at startup.
 */
public final class ReasoningProviders {
    private static final Logger LOG = LogManager.getLogger(ReasoningProviders.class);

    private ReasoningProviders() {
    }

    public static ReasoningProvider fromConfig(Config config, HttpClientEx http) {
        String kind = config.getString("reasoning.provider", "ollama").toLowerCase(Locale.ROOT);
        int timeoutSec = Math.max(1, config.getInt("reasoning.timeout_sec", 120));
        int maxTokens = Math.max(1, config.getInt("reasoning.max_tokens", 2000));
        double temperature = config.getDouble("reasoning.temperature", 0.0);

        ReasoningProvider provider;
        switch (kind) {
            case "ollama":
                provider = new OllamaReasoningProvider(
                        http,
                        config.getString("ollama.base_url", "http://localhost:11434"),
                        config.getString("ollama.model", "llama3.1:8b"),
                        timeoutSec,
                        maxTokens,
                        temperature
                );
                break;
            case "anthropic":
                String envKey = System.getenv("ANTHROPIC_API_KEY");
                provider = new AnthropicReasoningProvider(
                        envKey == null || envKey.isBlank() ? config.getString("anthropic.api_key", "") : envKey,
                        config.getString("anthropic.model", "claude-sonnet-4-5-20250929"),
                        timeoutSec,
                        maxTokens,
                        temperature
                );
                break;
            default:
                throw new IllegalStateException("unknown reasoning.provider '" + kind + "' (expected ollama or anthropic)");
        }
        LOG.info("reasoning provider={} timeout_sec={} max_tokens={}", provider.name(), timeoutSec, maxTokens);
        return provider;
    }
}
