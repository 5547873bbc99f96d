package com.docinsight.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    private static final String GLUED = "@startuml\nparticipantOrderService\nOrderService *-- Gateway\n@enduml\n";

    @TempDir
    Path tempDir;

    @Test
    void validate_withType_printsFixedDiagram() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("order.puml"), GLUED);

        // When
        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString(), "--type", "sequence");

        // Then
        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("participant OrderService")
            .contains("OrderService --> Gateway");
        assertThat(file).hasContent(GLUED);
    }

    @Test
    void validate_write_replacesFileContent() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("order.puml"), GLUED);

        // When
        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString(), "-t", "sequence", "--write");

        // Then
        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("Fixed diagram written to");
        assertThat(Files.readString(file)).contains("participant OrderService").doesNotContain("*--");
    }

    @Test
    void validate_missingMarkers_reportsUnrepairable() throws IOException {
        Path file = Files.writeString(tempDir.resolve("prose.puml"), "Api -> Db: query\n");

        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("Unrepairable:");
    }

    @Test
    void validate_unknownType_fails() throws IOException {
        Path file = Files.writeString(tempDir.resolve("order.puml"), GLUED);

        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString(), "--type", "gantt");

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("Unknown diagram type: gantt");
    }

    @Test
    void validate_missingFile_fails() {
        CliTestSupport.Run run = CliTestSupport.run("validate", tempDir.resolve("absent.puml").toString());

        assertThat(run.exitCode()).isEqualTo(1);
    }
}
