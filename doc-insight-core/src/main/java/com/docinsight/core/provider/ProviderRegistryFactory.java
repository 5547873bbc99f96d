package com.docinsight.core.provider;

import com.docinsight.core.config.ProjectConfig;
import com.docinsight.core.config.ProjectConfig.ProviderSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.function.Function;

/**
 * Builds a {@link ProviderRegistry} from configuration.
 *
 * <p>Providers whose API key variable is unset or blank are skipped with a warning, so a
 * configuration listing several providers works with whichever keys are available.
 */
public final class ProviderRegistryFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistryFactory.class);

    private ProviderRegistryFactory() {
        // Utility class
    }

    /**
     * Creates the registry for the configured providers.
     *
     * @param config project configuration
     * @param environment looks up environment variables (e.g. {@code System::getenv})
     * @return registry ordered by priority
     */
    public static ProviderRegistry fromConfig(ProjectConfig config, Function<String, String> environment) {
        HttpClient http = AbstractHttpCompletionProvider.defaultHttpClient();
        ObjectMapper json = new ObjectMapper();
        ProviderRegistry.Builder builder = ProviderRegistry.builder();

        for (ProviderSettings settings : config.providersByPriority()) {
            String apiKey = settings.apiKeyEnv() != null ? environment.apply(settings.apiKeyEnv()) : null;
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("Skipping provider {}: environment variable {} is not set", settings.id(), settings.apiKeyEnv());
                continue;
            }

            CompletionProvider provider = switch (settings.kind()) {
                case OPENAI_COMPATIBLE -> new OpenAiCompatibleProvider(settings, apiKey, http, json);
                case ANTHROPIC -> new AnthropicProvider(settings, apiKey, http, json);
            };
            builder.register(ProviderRecord.from(settings), provider);
            log.info("Registered provider {} ({}, priority {})", settings.id(), settings.kind(), settings.priority());
        }

        ProviderRegistry registry = builder.build();
        if (registry.isEmpty()) {
            log.warn("No completion providers available - check API keys");
        }
        return registry;
    }
}
