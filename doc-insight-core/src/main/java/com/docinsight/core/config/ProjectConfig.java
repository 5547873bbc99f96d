package com.docinsight.core.config;

import com.docinsight.core.model.DiagramType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Root configuration for DocInsight.
 *
 * <p>Loaded from {@code docinsight.yaml}. Defines the completion providers in priority
 * order, generation limits, the PlantUML toolchain and the output location. Every
 * numeric limit has a default, so a partial file is always usable.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * providers:
 *   - id: corporate
 *     kind: openai-compatible
 *     priority: 1
 *     baseUrl: "https://llm.internal.example/v1"
 *     apiKeyEnv: OPENAI_API_KEY
 *     model: gpt-4-turbo
 *   - id: anthropic
 *     kind: anthropic
 *     priority: 2
 *     apiKeyEnv: ANTHROPIC_API_KEY
 *     retryBudget: 3
 *     backoffBase: PT1S
 *     backoffCap: PT30S
 *
 * generation:
 *   significanceThreshold: 3
 *   maxRepairAttempts: 2
 *   diagramTypes: [architecture, sequence, class, use-cases]
 *
 * plantuml:
 *   command: plantuml
 *
 * output:
 *   directory: "./knowledge/insights"
 * }</pre>
 *
 * @param providers completion providers
 * @param generation generation limits
 * @param plantuml PlantUML toolchain settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("providers") List<ProviderSettings> providers,
    @JsonProperty("generation") GenerationSettings generation,
    @JsonProperty("plantuml") PlantUmlSettings plantuml,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ProjectConfig {
        providers = providers == null ? List.of() : List.copyOf(providers);
        if (generation == null) {
            generation = GenerationSettings.defaults();
        }
        if (plantuml == null) {
            plantuml = PlantUmlSettings.defaults();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Creates a default configuration with no providers configured.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(List.of(), null, null, null);
    }

    /**
     * Returns providers sorted by priority rank; ties keep declaration order.
     *
     * @return providers in call order
     */
    public List<ProviderSettings> providersByPriority() {
        return providers.stream()
            .sorted(Comparator.comparingInt(ProviderSettings::priority))
            .toList();
    }

    /**
     * Provider kinds with a built-in HTTP adapter.
     */
    public enum ProviderKind {
        @JsonProperty("openai-compatible") OPENAI_COMPATIBLE,
        @JsonProperty("anthropic") ANTHROPIC
    }

    /**
     * One completion provider.
     *
     * @param id unique provider identifier used in logs and results
     * @param kind adapter kind
     * @param priority rank, lower is called first
     * @param model model name sent to the provider
     * @param baseUrl API base URL, or null for the kind's public endpoint
     * @param apiKeyEnv environment variable holding the API key
     * @param retryBudget maximum calls to this provider per invocation
     * @param backoffBase first rate-limit backoff
     * @param backoffCap upper bound for a single backoff
     * @param timeout per-call timeout
     * @param maxTokens completion token limit
     * @param temperature sampling temperature
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProviderSettings(
        @JsonProperty("id") String id,
        @JsonProperty("kind") ProviderKind kind,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("model") String model,
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("apiKeyEnv") String apiKeyEnv,
        @JsonProperty("retryBudget") Integer retryBudget,
        @JsonProperty("backoffBase") Duration backoffBase,
        @JsonProperty("backoffCap") Duration backoffCap,
        @JsonProperty("timeout") Duration timeout,
        @JsonProperty("maxTokens") Integer maxTokens,
        @JsonProperty("temperature") Double temperature
    ) {
        public static final int DEFAULT_RETRY_BUDGET = 3;
        public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(1);
        public static final Duration DEFAULT_BACKOFF_CAP = Duration.ofSeconds(30);
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
        public static final int DEFAULT_MAX_TOKENS = 4096;
        public static final double DEFAULT_TEMPERATURE = 0.3;

        /**
         * Compact constructor applying defaults.
         */
        public ProviderSettings {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("provider id must not be blank");
            }
            if (kind == null) {
                kind = ProviderKind.OPENAI_COMPATIBLE;
            }
            if (priority == null) {
                priority = Integer.MAX_VALUE;
            }
            if (retryBudget == null) {
                retryBudget = DEFAULT_RETRY_BUDGET;
            }
            if (retryBudget < 1) {
                throw new IllegalArgumentException("retryBudget must be at least 1 for provider " + id);
            }
            if (backoffBase == null) {
                backoffBase = DEFAULT_BACKOFF_BASE;
            }
            if (backoffCap == null) {
                backoffCap = DEFAULT_BACKOFF_CAP;
            }
            if (timeout == null) {
                timeout = DEFAULT_TIMEOUT;
            }
            if (maxTokens == null) {
                maxTokens = DEFAULT_MAX_TOKENS;
            }
            if (temperature == null) {
                temperature = DEFAULT_TEMPERATURE;
            }
        }
    }

    /**
     * Generation limits.
     *
     * @param significanceThreshold minimum pattern significance for generation to run
     * @param maxRepairAttempts repair calls allowed per diagram
     * @param diagramTypes diagram types to generate, as slugs
     * @param renderImages whether valid diagrams are rendered to PNG
     * @param subprocessTimeout ceiling for checker and renderer invocations
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerationSettings(
        @JsonProperty("significanceThreshold") Integer significanceThreshold,
        @JsonProperty("maxRepairAttempts") Integer maxRepairAttempts,
        @JsonProperty("diagramTypes") List<String> diagramTypes,
        @JsonProperty("renderImages") Boolean renderImages,
        @JsonProperty("subprocessTimeout") Duration subprocessTimeout
    ) {
        public static final int DEFAULT_SIGNIFICANCE_THRESHOLD = 3;
        public static final int DEFAULT_MAX_REPAIR_ATTEMPTS = 2;
        public static final Duration DEFAULT_SUBPROCESS_TIMEOUT = Duration.ofMinutes(5);

        /**
         * Compact constructor applying defaults.
         */
        public GenerationSettings {
            if (significanceThreshold == null) {
                significanceThreshold = DEFAULT_SIGNIFICANCE_THRESHOLD;
            }
            if (maxRepairAttempts == null) {
                maxRepairAttempts = DEFAULT_MAX_REPAIR_ATTEMPTS;
            }
            if (maxRepairAttempts < 0) {
                throw new IllegalArgumentException("maxRepairAttempts must not be negative");
            }
            if (diagramTypes == null || diagramTypes.isEmpty()) {
                diagramTypes = Arrays.stream(DiagramType.values()).map(DiagramType::slug).toList();
            }
            diagramTypes = List.copyOf(diagramTypes);
            diagramTypes.forEach(DiagramType::fromValue);
            if (renderImages == null) {
                renderImages = Boolean.TRUE;
            }
            if (subprocessTimeout == null) {
                subprocessTimeout = DEFAULT_SUBPROCESS_TIMEOUT;
            }
        }

        /**
         * Creates default generation settings.
         *
         * @return defaults
         */
        public static GenerationSettings defaults() {
            return new GenerationSettings(null, null, null, null, null);
        }

        /**
         * Resolves the configured slugs into distinct diagram types, keeping order. Slugs are
         * checked on construction, so this never fails.
         *
         * @return diagram types to generate
         */
        public List<DiagramType> resolvedDiagramTypes() {
            return diagramTypes.stream().map(DiagramType::fromValue).distinct().toList();
        }
    }

    /**
     * PlantUML toolchain settings.
     *
     * @param command executable name or path
     * @param styleInclude optional {@code !include} target placed on the second line of every diagram
     * @param renderPollInterval delay between checks for the rendered image
     * @param renderPollAttempts number of checks before giving up on the image
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlantUmlSettings(
        @JsonProperty("command") String command,
        @JsonProperty("styleInclude") String styleInclude,
        @JsonProperty("renderPollInterval") Duration renderPollInterval,
        @JsonProperty("renderPollAttempts") Integer renderPollAttempts
    ) {
        /**
         * Compact constructor applying defaults.
         */
        public PlantUmlSettings {
            if (command == null || command.isBlank()) {
                command = "plantuml";
            }
            if (renderPollInterval == null) {
                renderPollInterval = Duration.ofMillis(200);
            }
            if (renderPollAttempts == null || renderPollAttempts < 1) {
                renderPollAttempts = 25;
            }
        }

        /**
         * Creates default PlantUML settings.
         *
         * @return defaults
         */
        public static PlantUmlSettings defaults() {
            return new PlantUmlSettings(null, null, null, null);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory
    ) {
        /**
         * Compact constructor applying defaults.
         */
        public OutputSettings {
            if (directory == null || directory.isBlank()) {
                directory = "./knowledge/insights";
            }
        }

        /**
         * Creates default output settings.
         *
         * @return defaults
         */
        public static OutputSettings defaults() {
            return new OutputSettings(null);
        }
    }
}
