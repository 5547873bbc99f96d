package com.docinsight.core.provider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, priority-ordered set of completion providers.
 *
 * <p>Constructed once at startup and passed to {@link CompletionGateway}. The order is
 * fixed for the lifetime of the registry: ascending priority rank, ties kept in
 * registration order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProviderRegistry registry = ProviderRegistry.builder()
 *     .register(ProviderRecord.withDefaults("corporate", 1), corporateProvider)
 *     .register(ProviderRecord.withDefaults("anthropic", 2), anthropicProvider)
 *     .build();
 * }</pre>
 */
public final class ProviderRegistry {

    private final List<Entry> entries;

    private ProviderRegistry(List<Entry> entries) {
        this.entries = entries.stream()
            .sorted(Comparator.comparingInt((Entry entry) -> entry.record().priority()))
            .toList();
    }

    /**
     * Creates a registry without providers; every invocation fails immediately.
     *
     * @return empty registry
     */
    public static ProviderRegistry empty() {
        return new ProviderRegistry(List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns providers in call order.
     *
     * @return ordered entries
     */
    public List<Entry> ordered() {
        return entries;
    }

    /**
     * Returns providers in call order, with the hinted provider moved to the front.
     *
     * <p>An unknown or null hint leaves the order unchanged.
     *
     * @param providerHint provider id to try first, or null
     * @return ordered entries
     */
    public List<Entry> orderedFor(String providerHint) {
        if (providerHint == null) {
            return entries;
        }
        List<Entry> reordered = new ArrayList<>(entries.size());
        entries.stream().filter(entry -> entry.record().id().equals(providerHint)).forEach(reordered::add);
        entries.stream().filter(entry -> !entry.record().id().equals(providerHint)).forEach(reordered::add);
        return List.copyOf(reordered);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * A provider and its call policy.
     *
     * @param record call policy
     * @param provider provider implementation
     */
    public record Entry(ProviderRecord record, CompletionProvider provider) {
        public Entry {
            Objects.requireNonNull(record, "record must not be null");
            Objects.requireNonNull(provider, "provider must not be null");
        }
    }

    /**
     * Collects providers before the registry is frozen.
     */
    public static final class Builder {

        private final List<Entry> entries = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a provider.
         *
         * @param record call policy
         * @param provider provider implementation
         * @return this builder
         * @throws IllegalArgumentException if the id is already registered
         */
        public Builder register(ProviderRecord record, CompletionProvider provider) {
            boolean duplicate = entries.stream().anyMatch(entry -> entry.record().id().equals(record.id()));
            if (duplicate) {
                throw new IllegalArgumentException("Duplicate provider id: " + record.id());
            }
            entries.add(new Entry(record, provider));
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(List.copyOf(entries));
        }
    }
}
