package com.docinsight.core.provider;

import com.docinsight.core.config.ProjectConfig.ProviderSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for providers that speak JSON over HTTP.
 *
 * <p>Subclasses build the request body and extract the text from the response; this class
 * owns the HTTP exchange, status handling and parameter defaults. Non-2xx responses are
 * raised as {@link ProviderException} carrying the status code.
 */
public abstract class AbstractHttpCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpCompletionProvider.class);

    /** System prompt shared by every provider. */
    protected static final String SYSTEM_PROMPT =
        "You are an expert semantic analysis AI specializing in code analysis, technical documentation, "
            + "and software development patterns. Provide precise, structured, and actionable insights.";

    private static final int MAX_ERROR_BODY_LENGTH = 300;

    protected final ProviderSettings settings;
    protected final ObjectMapper json;
    private final HttpClient http;
    private final String apiKey;

    protected AbstractHttpCompletionProvider(ProviderSettings settings, String apiKey, HttpClient http, ObjectMapper json) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.json = Objects.requireNonNull(json, "json must not be null");
    }

    @Override
    public String id() {
        return settings.id();
    }

    @Override
    public String complete(CompletionRequest request) {
        int maxTokens = request.options().maxTokens() != null ? request.options().maxTokens() : settings.maxTokens();
        double temperature = request.options().temperature() != null
            ? request.options().temperature()
            : settings.temperature();

        String body;
        try {
            body = json.writeValueAsString(requestBody(request.prompt(), maxTokens, temperature));
        } catch (JsonProcessingException e) {
            throw new ProviderException("Failed to encode request for provider " + id(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(endpoint())
            .timeout(settings.timeout())
            .header("content-type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        headers(apiKey).forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("HTTP call to provider " + id() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("HTTP call to provider " + id() + " interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new ProviderException(response.statusCode(),
                "Provider " + id() + " returned " + response.statusCode() + ": " + abbreviate(response.body()));
        }

        try {
            String text = extractText(json.readTree(response.body()));
            log.debug("Provider {} returned {} chars", id(), text == null ? 0 : text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw new ProviderException("Provider " + id() + " returned malformed JSON", e);
        }
    }

    /**
     * Returns the full endpoint URI for a completion call.
     *
     * @return endpoint
     */
    protected abstract URI endpoint();

    /**
     * Returns provider-specific headers (authentication, API version).
     *
     * @param apiKey API key
     * @return header map
     */
    protected abstract Map<String, String> headers(String apiKey);

    /**
     * Builds the JSON request body as a Jackson-serializable value.
     *
     * @param prompt user prompt
     * @param maxTokens completion token limit
     * @param temperature sampling temperature
     * @return body value
     */
    protected abstract Object requestBody(String prompt, int maxTokens, double temperature);

    /**
     * Extracts the generated text from the parsed response.
     *
     * @param response parsed response body
     * @return generated text, or null if none is present
     */
    protected abstract String extractText(JsonNode response);

    /**
     * Resolves the base URL, stripping a trailing slash.
     *
     * @param defaultBaseUrl base URL used when none is configured
     * @return base URL
     */
    protected String baseUrl(String defaultBaseUrl) {
        String base = settings.baseUrl() != null && !settings.baseUrl().isBlank() ? settings.baseUrl() : defaultBaseUrl;
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    /**
     * Creates an HTTP client suitable for provider calls.
     *
     * @return HTTP client
     */
    public static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}
