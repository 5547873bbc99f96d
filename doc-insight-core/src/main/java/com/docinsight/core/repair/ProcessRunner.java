package com.docinsight.core.repair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external tools with a timeout, capturing stdout and stderr separately.
 *
 * <p>A process that exceeds its timeout is killed; the caller gets a result with
 * {@link ProcessResult#timedOut()} set. A process that cannot be started (tool not
 * installed) yields exit code {@link ProcessResult#NOT_STARTED}.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final long STREAM_DRAIN_MILLIS = 1000;

    /**
     * Runs a command.
     *
     * @param command executable and arguments
     * @param workingDirectory working directory, or null for the current one
     * @param timeout maximum run time
     * @return process result
     */
    public ProcessResult run(List<String> command, Path workingDirectory, Duration timeout) {
        long start = System.nanoTime();
        log.debug("Executing: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Failed to start {}: {}", command.get(0), e.getMessage());
            return new ProcessResult(ProcessResult.NOT_STARTED, "", "Failed to start " + command.get(0) + ": "
                + e.getMessage(), false, elapsedSince(start));
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Process {} timed out after {}ms", command.get(0), timeout.toMillis());
                return new ProcessResult(ProcessResult.TIMED_OUT, collect(stdout), collect(stderr), true,
                    elapsedSince(start));
            }
            int exitCode = process.exitValue();
            log.debug("Process {} exited with code {}", command.get(0), exitCode);
            return new ProcessResult(exitCode, collect(stdout), collect(stderr), false, elapsedSince(start));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new ProcessResult(ProcessResult.TIMED_OUT, "", "interrupted", true, elapsedSince(start));
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(STREAM_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not read process output: {}", e.getMessage());
            return "";
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
