package com.example.agentflow.agent;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import lombok.Getter;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds a {@link ChatModel} for OpenRouter (OpenAI-compatible API), one per agent model name.
 * API key is read from config/env only; startup fails if key is missing.
 */
@Component
public class OpenRouterChatModelFactory {

    private static final String FALLBACK_BASE_URL = "https://openrouter.ai/api/v1";
    private static final String FALLBACK_MODEL = "openai/gpt-4o-mini";

    private final String apiKey;
    private final String baseUrl;
    @Getter
    private final String defaultModel;
    private final Duration timeout;

    public OpenRouterChatModelFactory(
            @Value("${openrouter.api-key:}") String apiKey,
            @Value("${openrouter.base-url:" + FALLBACK_BASE_URL + "}") String baseUrl,
            @Value("${openrouter.model:" + FALLBACK_MODEL + "}") String defaultModel,
            @Value("${openrouter.timeout:120s}") Duration timeout) {
        String key = apiKey != null ? apiKey.trim() : "";
        if (key.isEmpty()) {
            throw new IllegalStateException(
                    "OpenRouter API key is required. Set OPENROUTER_API_KEY in the environment or openrouter.api-key in configuration.");
        }
        this.apiKey = key;
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : FALLBACK_BASE_URL;
        this.defaultModel = defaultModel != null && !defaultModel.isBlank() ? defaultModel.trim() : FALLBACK_MODEL;
        this.timeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : Duration.ofSeconds(120);
    }

    /**
     * Builds a ChatModel for the given model name; blank falls back to the configured default.
     */
    public ChatModel build(String modelName) {
        String model = modelName != null && !modelName.isBlank() ? modelName.trim() : defaultModel;
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .modelName(model)
                .timeout(timeout)
                .build();
    }
}
