package com.docinsight.core.provider;

import com.docinsight.core.config.ProjectConfig.ProviderSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

/**
 * Provider for OpenAI chat-completions compatible endpoints.
 *
 * <p>Covers both the public OpenAI API and self-hosted or corporate gateways exposing the
 * same contract under a custom {@code baseUrl}.
 */
public class OpenAiCompatibleProvider extends AbstractHttpCompletionProvider {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_MODEL = "gpt-4-turbo-preview";

    public OpenAiCompatibleProvider(ProviderSettings settings, String apiKey, HttpClient http, ObjectMapper json) {
        super(settings, apiKey, http, json);
    }

    @Override
    protected URI endpoint() {
        return URI.create(baseUrl(DEFAULT_BASE_URL) + "/chat/completions");
    }

    @Override
    protected Map<String, String> headers(String apiKey) {
        return Map.of("authorization", "Bearer " + apiKey);
    }

    @Override
    protected Object requestBody(String prompt, int maxTokens, double temperature) {
        return Map.of(
            "model", settings.model() != null ? settings.model() : DEFAULT_MODEL,
            "messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
            ),
            "max_tokens", maxTokens,
            "temperature", temperature
        );
    }

    @Override
    protected String extractText(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
