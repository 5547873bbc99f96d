package com.docinsight.core.repair;

import com.docinsight.core.provider.Sleeper;
import com.docinsight.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders PNG images with {@code <command> -tpng <file> -o <dir>}.
 *
 * <p>PlantUML can exit with 0 without producing a file, so success is confirmed by polling
 * for {@code <dir>/<basename>.png}. The output directory is passed relative to the source
 * file's directory, as PlantUML resolves {@code -o} against it.
 */
public class PlantUmlRenderer implements DiagramRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlantUmlRenderer.class);

    private final String command;
    private final ProcessRunner runner;
    private final Duration timeout;
    private final Duration pollInterval;
    private final int pollAttempts;
    private final Sleeper sleeper;

    public PlantUmlRenderer(String command, ProcessRunner runner, Duration timeout,
                            Duration pollInterval, int pollAttempts, Sleeper sleeper) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.pollAttempts = Math.max(1, pollAttempts);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public Optional<Path> render(Path sourceFile, Path imageDirectory) {
        Path expected = imageDirectory.resolve(FileUtils.getBaseName(sourceFile) + ".png");
        try {
            Files.createDirectories(imageDirectory);
        } catch (IOException e) {
            log.warn("Cannot create image directory {}: {}", imageDirectory, e.getMessage());
            return Optional.empty();
        }

        Path sourceDir = sourceFile.toAbsolutePath().getParent();
        String outputDir = sourceDir.relativize(imageDirectory.toAbsolutePath()).toString();
        ProcessResult result = runner.run(List.of(command, "-tpng", sourceFile.toString(), "-o", outputDir),
            null, timeout);
        if (!result.succeeded()) {
            log.warn("PlantUML render of {} exited with {}: {}", sourceFile.getFileName(), result.exitCode(),
                result.stderr().trim());
        }

        return awaitImage(expected);
    }

    private Optional<Path> awaitImage(Path expected) {
        for (int attempt = 1; attempt <= pollAttempts; attempt++) {
            if (Files.isRegularFile(expected)) {
                return Optional.of(expected);
            }
            if (attempt < pollAttempts) {
                try {
                    sleeper.sleep(pollInterval);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.warn("PlantUML finished but image not found at {}", expected);
        return Optional.empty();
    }
}
