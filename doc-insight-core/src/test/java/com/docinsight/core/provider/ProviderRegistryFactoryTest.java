package com.docinsight.core.provider;

import com.docinsight.core.config.ProjectConfig;
import com.docinsight.core.config.ProjectConfig.ProviderKind;
import com.docinsight.core.config.ProjectConfig.ProviderSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProviderRegistryFactory}.
 */
class ProviderRegistryFactoryTest {

    private static ProviderSettings provider(String id, ProviderKind kind, int priority, String keyEnv) {
        return new ProviderSettings(id, kind, priority, null, null, keyEnv, null, null, null, null, null, null);
    }

    @Test
    void fromConfig_skipsProvidersWithoutApiKey() {
        // Given
        ProjectConfig config = new ProjectConfig(List.of(
            provider("anthropic", ProviderKind.ANTHROPIC, 2, "ANTHROPIC_API_KEY"),
            provider("corporate", ProviderKind.OPENAI_COMPATIBLE, 1, "CORP_KEY"),
            provider("openai", ProviderKind.OPENAI_COMPATIBLE, 3, "OPENAI_API_KEY")
        ), null, null, null);
        Map<String, String> environment = Map.of("ANTHROPIC_API_KEY", "sk-ant", "CORP_KEY", "corp", "OPENAI_API_KEY", " ");

        // When
        ProviderRegistry registry = ProviderRegistryFactory.fromConfig(config, environment::get);

        // Then
        assertThat(registry.ordered())
            .extracting(entry -> entry.record().id())
            .containsExactly("corporate", "anthropic");
        assertThat(registry.ordered().get(0).provider()).isInstanceOf(OpenAiCompatibleProvider.class);
        assertThat(registry.ordered().get(1).provider()).isInstanceOf(AnthropicProvider.class);
    }

    @Test
    void fromConfig_noKeys_returnsEmptyRegistry() {
        ProjectConfig config = new ProjectConfig(List.of(
            provider("anthropic", ProviderKind.ANTHROPIC, 1, "ANTHROPIC_API_KEY")), null, null, null);

        ProviderRegistry registry = ProviderRegistryFactory.fromConfig(config, name -> null);

        assertThat(registry.isEmpty()).isTrue();
    }
}
