package com.docinsight.core.provider;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ProviderRegistry}.
 */
class ProviderRegistryTest {

    private static List<String> ids(List<ProviderRegistry.Entry> entries) {
        return entries.stream().map(entry -> entry.record().id()).toList();
    }

    @Test
    void ordered_sortsByPriorityKeepingRegistrationOrderForTies() {
        // Given
        ProviderRegistry registry = ProviderRegistry.builder()
            .register(ProviderRecord.withDefaults("c", 3), ScriptedProvider.scripted("c", "x"))
            .register(ProviderRecord.withDefaults("a", 1), ScriptedProvider.scripted("a", "x"))
            .register(ProviderRecord.withDefaults("b1", 2), ScriptedProvider.scripted("b1", "x"))
            .register(ProviderRecord.withDefaults("b2", 2), ScriptedProvider.scripted("b2", "x"))
            .build();

        // When / Then
        assertThat(ids(registry.ordered())).containsExactly("a", "b1", "b2", "c");
        assertThat(registry.size()).isEqualTo(4);
    }

    @Test
    void orderedFor_knownHint_movesProviderToFront() {
        ProviderRegistry registry = ProviderRegistry.builder()
            .register(ProviderRecord.withDefaults("a", 1), ScriptedProvider.scripted("a", "x"))
            .register(ProviderRecord.withDefaults("b", 2), ScriptedProvider.scripted("b", "x"))
            .register(ProviderRecord.withDefaults("c", 3), ScriptedProvider.scripted("c", "x"))
            .build();

        assertThat(ids(registry.orderedFor("c"))).containsExactly("c", "a", "b");
        assertThat(ids(registry.orderedFor("unknown"))).containsExactly("a", "b", "c");
    }

    @Test
    void register_duplicateId_throwsException() {
        ProviderRegistry.Builder builder = ProviderRegistry.builder()
            .register(ProviderRecord.withDefaults("a", 1), ScriptedProvider.scripted("a", "x"));

        assertThatThrownBy(() -> builder.register(ProviderRecord.withDefaults("a", 2), ScriptedProvider.scripted("a", "y")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate provider id");
    }

    @Test
    void empty_hasNoProviders() {
        assertThat(ProviderRegistry.empty().isEmpty()).isTrue();
    }
}
