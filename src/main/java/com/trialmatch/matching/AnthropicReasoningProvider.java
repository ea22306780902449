package com.trialmatch.matching;

import com.trialmatch.error.ProviderUnavailableException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatLanguageModel;

import java.time.Duration;

/**
 * Anthropic Claude through LangChain4j. The chat envelope is unwrapped by the model client,
 * so {@link #execute(String)} returns the assistant text only.
 */
public final class AnthropicReasoningProvider implements ReasoningProvider {
    private final ChatLanguageModel chatModel;
    private final String modelName;

    public AnthropicReasoningProvider(String apiKey, String modelName, int timeoutSeconds, int maxTokens, double temperature) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("anthropic.api_key (or ANTHROPIC_API_KEY) is required for the anthropic provider");
        }
        this.modelName = modelName;
        this.chatModel = AnthropicChatModel.builder()
                .apiKey(apiKey.trim())
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .maxRetries(1)
                .build();
    }

    AnthropicReasoningProvider(ChatLanguageModel chatModel, String modelName) {
        this.chatModel = chatModel;
        this.modelName = modelName;
    }

    @Override
    public String name() {
        return "anthropic:" + modelName;
    }

    /**
     * Sends the prompt as a single user message and returns the model's text. Model errors are
     * reported as {@link com.trialmatch.error.ProviderUnavailableException}.
     */
    @Override
    public String execute(String prompt) {
        String out;
        try {
            out = chatModel.generate(prompt == null ? "" : prompt);
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException(name(), "anthropic call failed: " + rootMessage(e), e);
        }
        if (out == null) {
            throw new ProviderUnavailableException(name(), "anthropic returned no content");
        }
        return out;
    }

    private static String rootMessage(Throwable e) {
        Throwable cur = e;
        while (cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        return cur.getMessage() == null ? cur.getClass().getSimpleName() : cur.getMessage();
    }
}
