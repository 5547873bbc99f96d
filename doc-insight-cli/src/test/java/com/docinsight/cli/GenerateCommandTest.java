package com.docinsight.cli;

import com.docinsight.core.model.GenerationResult;
import com.docinsight.core.model.JobFailure;
import com.docinsight.core.model.JobStatus;
import com.docinsight.core.model.SignificanceDiagnostics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenerateCommand}. Only paths that need no provider are exercised.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void generate_noSignificantPattern_reportsSkippedAndSucceeds() throws IOException {
        // Given
        Path request = Files.writeString(tempDir.resolve("request.json"), """
            {
              "entity": {"name": "OrderService", "observations": ["Coordinates orders"]},
              "patterns": [
                {"name": "Logging", "category": "workflow", "significance": 1},
                {"name": "Retry", "significance": 2}
              ]
            }
            """);
        Path output = tempDir.resolve("out");

        // When
        CliTestSupport.Run run = CliTestSupport.run("generate", request.toString(),
            "-c", tempDir.resolve("missing.yaml").toString(), "-o", output.toString());

        // Then
        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("Entity:      OrderService")
            .contains("Status:      SKIPPED")
            .contains("Documents:   0");
        assertThat(output).doesNotExist();
    }

    @Test
    void generate_unreadableRequest_fails() throws IOException {
        Path request = Files.writeString(tempDir.resolve("request.json"), "{ not json");

        CliTestSupport.Run run = CliTestSupport.run("generate", request.toString(),
            "-c", tempDir.resolve("missing.yaml").toString());

        assertThat(run.exitCode()).isEqualTo(1);
    }

    @Test
    void printSummary_failedJob_includesFailure() {
        GenerationResult result = new GenerationResult("OrderService", JobStatus.FAILED,
            JobFailure.CONTENT_GENERATION_FAILED, "narrative draft was empty", null, List.of(),
            new SignificanceDiagnostics(3, 1, 1, Map.of(5, 1), List.of()), null);
        StringWriter buffer = new StringWriter();

        GenerateCommand.printSummary(new PrintWriter(buffer), result);

        assertThat(buffer.toString())
            .contains("Status:      FAILED")
            .contains("Failure:     CONTENT_GENERATION_FAILED - narrative draft was empty");
    }
}
