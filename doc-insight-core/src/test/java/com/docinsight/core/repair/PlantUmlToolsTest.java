package com.docinsight.core.repair;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PlantUmlSyntaxChecker} and {@link PlantUmlRenderer} with a fake process runner.
 */
class PlantUmlToolsTest {

    @TempDir
    Path tempDir;

    private final List<Duration> sleeps = new ArrayList<>();

    /**
     * Records commands and answers with a canned result, optionally creating the rendered image.
     */
    private static class FakeRunner extends ProcessRunner {
        final List<List<String>> commands = new ArrayList<>();
        private final ProcessResult result;
        private final Path createOnRun;

        FakeRunner(ProcessResult result, Path createOnRun) {
            this.result = result;
            this.createOnRun = createOnRun;
        }

        @Override
        public ProcessResult run(List<String> command, Path workingDirectory, Duration timeout) {
            commands.add(command);
            if (createOnRun != null) {
                try {
                    Files.write(createOnRun, new byte[]{(byte) 0x89, 'P', 'N', 'G'});
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return result;
        }
    }

    private static ProcessResult exit(int code, String stdout, String stderr) {
        return new ProcessResult(code, stdout, stderr, false, Duration.ofMillis(5));
    }

    @Test
    void check_exitZero_passes() {
        FakeRunner runner = new FakeRunner(exit(0, "", ""), null);
        PlantUmlSyntaxChecker checker = new PlantUmlSyntaxChecker("plantuml", runner, Duration.ofSeconds(10));

        CheckResult result = checker.check(Path.of("a.puml"));

        assertThat(result.valid()).isTrue();
        assertThat(runner.commands).containsExactly(List.of("plantuml", "-checkonly", "a.puml"));
    }

    @Test
    void check_nonZeroExit_usesStderrThenStdoutAsDiagnostic() {
        PlantUmlSyntaxChecker fromStderr = new PlantUmlSyntaxChecker("plantuml",
            new FakeRunner(exit(200, "ignored", "Error line 4 in file: a.puml\n"), null), Duration.ofSeconds(10));
        PlantUmlSyntaxChecker fromStdout = new PlantUmlSyntaxChecker("plantuml",
            new FakeRunner(exit(200, "Syntax Error?", " "), null), Duration.ofSeconds(10));
        PlantUmlSyntaxChecker silent = new PlantUmlSyntaxChecker("plantuml",
            new FakeRunner(exit(1, "", ""), null), Duration.ofSeconds(10));

        assertThat(fromStderr.check(Path.of("a.puml")).diagnostic()).isEqualTo("Error line 4 in file: a.puml");
        assertThat(fromStdout.check(Path.of("a.puml")).diagnostic()).isEqualTo("Syntax Error?");
        assertThat(silent.check(Path.of("a.puml")).diagnostic()).isEqualTo("Exit code 1");
    }

    @Test
    void check_timeout_failsWithTimeoutDiagnostic() {
        ProcessResult timedOut = new ProcessResult(ProcessResult.TIMED_OUT, "", "", true, Duration.ofSeconds(3));
        PlantUmlSyntaxChecker checker = new PlantUmlSyntaxChecker("plantuml", new FakeRunner(timedOut, null),
            Duration.ofSeconds(3));

        assertThat(checker.check(Path.of("a.puml")).diagnostic()).isEqualTo("syntax check timed out after 3s");
    }

    @Test
    void render_imageAppears_returnsImagePath() throws IOException {
        // Given
        Path diagrams = Files.createDirectories(tempDir.resolve("diagrams"));
        Path source = diagrams.resolve("order-service-class.puml");
        Files.writeString(source, "@startuml\nclass A\n@enduml");
        Path images = tempDir.resolve("images");
        Files.createDirectories(images);
        FakeRunner runner = new FakeRunner(exit(0, "", ""), images.resolve("order-service-class.png"));
        PlantUmlRenderer renderer = new PlantUmlRenderer("plantuml", runner, Duration.ofSeconds(10),
            Duration.ofMillis(200), 5, sleeps::add);

        // When
        Optional<Path> image = renderer.render(source, images);

        // Then
        assertThat(image).contains(images.resolve("order-service-class.png"));
        assertThat(runner.commands).containsExactly(
            List.of("plantuml", "-tpng", source.toString(), "-o", "../images"));
        assertThat(sleeps).isEmpty();
    }

    @Test
    void render_noImageProduced_pollsThenGivesUp() throws IOException {
        // Given
        Path source = tempDir.resolve("x-sequence.puml");
        Files.writeString(source, "@startuml\nA -> B\n@enduml");
        PlantUmlRenderer renderer = new PlantUmlRenderer("plantuml", new FakeRunner(exit(0, "", ""), null),
            Duration.ofSeconds(10), Duration.ofMillis(200), 3, sleeps::add);

        // When
        Optional<Path> image = renderer.render(source, tempDir.resolve("images"));

        // Then
        assertThat(image).isEmpty();
        assertThat(sleeps).containsExactly(Duration.ofMillis(200), Duration.ofMillis(200));
    }
}
