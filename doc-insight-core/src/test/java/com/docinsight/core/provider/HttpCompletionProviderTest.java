package com.docinsight.core.provider;

import com.docinsight.core.config.ProjectConfig.ProviderKind;
import com.docinsight.core.config.ProjectConfig.ProviderSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the HTTP provider adapters against a local server.
 */
class HttpCompletionProviderTest {

    private final ObjectMapper json = new ObjectMapper();
    private final Map<String, String> received = new ConcurrentHashMap<>();
    private HttpServer server;
    private volatile int status = 200;
    private volatile String responseBody = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            received.put("path", exchange.getRequestURI().getPath());
            received.put("body", new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String auth = exchange.getRequestHeaders().getFirst("authorization");
            String apiKey = exchange.getRequestHeaders().getFirst("x-api-key");
            if (auth != null) {
                received.put("authorization", auth);
            }
            if (apiKey != null) {
                received.put("x-api-key", apiKey);
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private ProviderSettings settings(ProviderKind kind) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/";
        return new ProviderSettings("local", kind, 1, "test-model", baseUrl, "KEY", null, null, null, null, 256, 0.1);
    }

    @Test
    void complete_openAiCompatible_postsChatRequestAndReturnsContent() throws IOException {
        // Given
        responseBody = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"generated\"}}]}";
        OpenAiCompatibleProvider provider = new OpenAiCompatibleProvider(settings(ProviderKind.OPENAI_COMPATIBLE),
            "secret", AbstractHttpCompletionProvider.defaultHttpClient(), json);

        // When
        String text = provider.complete(new CompletionRequest("Describe OrderService", null));

        // Then
        assertThat(text).isEqualTo("generated");
        assertThat(received.get("path")).isEqualTo("/v1/chat/completions");
        assertThat(received.get("authorization")).isEqualTo("Bearer secret");
        JsonNode body = json.readTree(received.get("body"));
        assertThat(body.path("model").asText()).isEqualTo("test-model");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(256);
        assertThat(body.path("messages").path(1).path("content").asText()).isEqualTo("Describe OrderService");
    }

    @Test
    void complete_anthropic_returnsFirstTextBlock() throws IOException {
        // Given
        responseBody = "{\"content\":[{\"type\":\"text\",\"text\":\"from claude\"}]}";
        AnthropicProvider provider = new AnthropicProvider(settings(ProviderKind.ANTHROPIC),
            "sk-ant", AbstractHttpCompletionProvider.defaultHttpClient(), json);

        // When
        String text = provider.complete(new CompletionRequest("prompt", new CompletionOptions(100, null, null)));

        // Then
        assertThat(text).isEqualTo("from claude");
        assertThat(received.get("path")).isEqualTo("/v1/messages");
        assertThat(received.get("x-api-key")).isEqualTo("sk-ant");
        assertThat(json.readTree(received.get("body")).path("max_tokens").asInt()).isEqualTo(100);
    }

    @Test
    void complete_status429_raisesRateLimitedProviderException() {
        // Given
        status = 429;
        responseBody = "{\"error\":\"rate_limit_exceeded\"}";
        OpenAiCompatibleProvider provider = new OpenAiCompatibleProvider(settings(ProviderKind.OPENAI_COMPATIBLE),
            "secret", AbstractHttpCompletionProvider.defaultHttpClient(), json);

        // When / Then
        assertThatThrownBy(() -> provider.complete(new CompletionRequest("prompt", null)))
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.statusCode()).isEqualTo(429);
                assertThat(provider.classify(e)).isEqualTo(FailureKind.RATE_LIMITED);
            });
    }

    @Test
    void complete_malformedJson_raisesFatalProviderException() {
        // Given
        responseBody = "not json";
        AnthropicProvider provider = new AnthropicProvider(settings(ProviderKind.ANTHROPIC),
            "sk-ant", AbstractHttpCompletionProvider.defaultHttpClient(), json);

        // When / Then
        assertThatThrownBy(() -> provider.complete(new CompletionRequest("prompt", null)))
            .isInstanceOfSatisfying(ProviderException.class,
                e -> assertThat(provider.classify(e)).isEqualTo(FailureKind.FATAL));
    }
}
