package com.docinsight.core.provider;

import com.docinsight.core.config.ProjectConfig.ProviderSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

/**
 * Provider for the Anthropic Messages API.
 */
public class AnthropicProvider extends AbstractHttpCompletionProvider {

    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    private static final String DEFAULT_MODEL = "claude-3-5-sonnet-20241022";
    private static final String API_VERSION = "2023-06-01";

    public AnthropicProvider(ProviderSettings settings, String apiKey, HttpClient http, ObjectMapper json) {
        super(settings, apiKey, http, json);
    }

    @Override
    protected URI endpoint() {
        return URI.create(baseUrl(DEFAULT_BASE_URL) + "/messages");
    }

    @Override
    protected Map<String, String> headers(String apiKey) {
        return Map.of(
            "x-api-key", apiKey,
            "anthropic-version", API_VERSION
        );
    }

    @Override
    protected Object requestBody(String prompt, int maxTokens, double temperature) {
        return Map.of(
            "model", settings.model() != null ? settings.model() : DEFAULT_MODEL,
            "max_tokens", maxTokens,
            "temperature", temperature,
            "system", SYSTEM_PROMPT,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );
    }

    @Override
    protected String extractText(JsonNode response) {
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                return block.path("text").asText();
            }
        }
        return null;
    }
}
