package com.docinsight.core.repair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs {@code <command> -checkonly <file>}. Exit code 0 means valid; otherwise stderr (or
 * stdout, which some PlantUML versions use) becomes the diagnostic.
 */
public class PlantUmlSyntaxChecker implements SyntaxChecker {

    private static final Logger log = LoggerFactory.getLogger(PlantUmlSyntaxChecker.class);

    private final String command;
    private final ProcessRunner runner;
    private final Duration timeout;

    public PlantUmlSyntaxChecker(String command, ProcessRunner runner, Duration timeout) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public CheckResult check(Path sourceFile) {
        ProcessResult result = runner.run(List.of(command, "-checkonly", sourceFile.toString()), null, timeout);

        if (result.succeeded()) {
            return CheckResult.passed();
        }
        if (result.timedOut()) {
            return CheckResult.failed("syntax check timed out after " + timeout.toSeconds() + "s");
        }

        String diagnostic = !result.stderr().isBlank() ? result.stderr().trim()
            : !result.stdout().isBlank() ? result.stdout().trim()
            : "Exit code " + result.exitCode();
        log.debug("Syntax check failed for {}: {}", sourceFile.getFileName(), diagnostic);
        return CheckResult.failed(diagnostic);
    }
}
