package com.docinsight.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Reads {@code docinsight.yaml} into a {@link ProjectConfig}.
 *
 * <p>Durations are ISO-8601 ({@code PT30S}). Loading never fails: a missing, unreadable,
 * empty or invalid file (including values rejected by the record constructors, such as a
 * retry budget of 0) yields {@link ProjectConfig#defaults()} and a log entry saying why.
 *
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Path.of("docinsight.yaml"));
 * ProviderRegistry registry = ProviderRegistryFactory.fromConfig(config, System::getenv);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .registerModule(new JavaTimeModule());

    /**
     * Loads the configuration, falling back to defaults.
     *
     * @param configPath path to {@code docinsight.yaml}
     * @return parsed configuration, or defaults when the file cannot be used
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return fallback(configPath, "file not found");
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            return fallback(configPath, "not a readable file");
        }

        ProjectConfig config;
        try {
            config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
        if (config == null) {
            return fallback(configPath, "file is empty");
        }

        log.info("Loaded configuration from {}: providers [{}], significance threshold {}, {} repair attempt(s)",
            configPath,
            config.providersByPriority().stream().map(ProjectConfig.ProviderSettings::id)
                .collect(Collectors.joining(", ")),
            config.generation().significanceThreshold(),
            config.generation().maxRepairAttempts());
        return config;
    }

    private static ProjectConfig fallback(Path configPath, String reason) {
        log.warn("Using default configuration, {}: {}", reason, configPath);
        return ProjectConfig.defaults();
    }
}
