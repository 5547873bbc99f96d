package com.docinsight.core.repair;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProcessRunner} using the POSIX shell.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    void run_capturesExitCodeAndBothStreams() {
        ProcessResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), null,
            Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("out\n");
        assertThat(result.stderr()).isEqualTo("err\n");
        assertThat(result.succeeded()).isFalse();
        assertThat(result.timedOut()).isFalse();
    }

    @Test
    void run_exceedsTimeout_killsProcess() {
        ProcessResult result = runner.run(List.of("sh", "-c", "sleep 10"), null, Duration.ofMillis(200));

        assertThat(result.timedOut()).isTrue();
        assertThat(result.exitCode()).isEqualTo(ProcessResult.TIMED_OUT);
        assertThat(result.duration()).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void run_missingExecutable_reportsNotStarted() {
        ProcessResult result = runner.run(List.of("definitely-not-a-real-tool-4711"), null, Duration.ofSeconds(5));

        assertThat(result.exitCode()).isEqualTo(ProcessResult.NOT_STARTED);
        assertThat(result.stderr()).contains("Failed to start definitely-not-a-real-tool-4711");
    }
}
