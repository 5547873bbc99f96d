package com.docinsight.core.repair;

import com.docinsight.core.model.ArtifactStatus;
import com.docinsight.core.model.DiagramType;
import com.docinsight.core.provider.CompletionGateway;
import com.docinsight.core.provider.ProviderRecord;
import com.docinsight.core.provider.ProviderRegistry;
import com.docinsight.core.provider.ScriptedProvider;
import com.docinsight.core.validator.PlantUmlValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ArtifactRepairLoop}.
 */
class ArtifactRepairLoopTest {

    private static final String VALID_SEQUENCE = "@startuml\nparticipant Api\nApi -> Db: query\n@enduml";
    private static final String REPAIRED_SEQUENCE = "@startuml\nparticipant Api\nparticipant Db\nApi -> Db: query\n@enduml";

    @TempDir
    Path workspace;

    private final List<Path> checkedFiles = new ArrayList<>();
    private CompletionGateway gateway;

    @AfterEach
    void tearDown() {
        if (gateway != null) {
            gateway.close();
        }
    }

    private ArtifactRepairLoop loop(ScriptedProvider provider, SyntaxChecker checker) {
        ProviderRegistry registry = provider == null
            ? ProviderRegistry.empty()
            : ProviderRegistry.builder().register(ProviderRecord.withDefaults(provider.id(), 1), provider).build();
        gateway = new CompletionGateway(registry, duration -> { });
        return new ArtifactRepairLoop(gateway, new PlantUmlValidator(), checker, new RepairPromptBuilder());
    }

    private SyntaxChecker recording(CheckResult... verdicts) {
        return sourceFile -> {
            checkedFiles.add(sourceFile);
            int index = Math.min(checkedFiles.size(), verdicts.length) - 1;
            return verdicts[index];
        };
    }

    private static DiagramArtifact draft(String rawText) {
        DiagramArtifact artifact = new DiagramArtifact(DiagramType.SEQUENCE, "order-service-sequence", 2);
        artifact.setRawText(rawText);
        return artifact;
    }

    @Test
    void run_checkerAcceptsDraft_validWithoutRepairCalls() throws IOException {
        // Given
        ScriptedProvider provider = ScriptedProvider.scripted("llm", REPAIRED_SEQUENCE);
        DiagramArtifact artifact = draft(VALID_SEQUENCE);

        // When
        RepairResult result = loop(provider, recording(CheckResult.passed())).run(artifact, workspace);

        // Then
        Path expected = workspace.resolve("diagrams/order-service-sequence.puml");
        assertThat(result).isEqualTo(new RepairResult.Valid(VALID_SEQUENCE, expected, 0));
        assertThat(expected).hasContent(VALID_SEQUENCE);
        assertThat(artifact.status()).isEqualTo(ArtifactStatus.VALID);
        assertThat(artifact.validatedText()).isEqualTo(VALID_SEQUENCE);
        assertThat(provider.calls()).isZero();
    }

    @Test
    void run_checkerRejectsThenAccepts_usesRepairedText() throws IOException {
        // Given
        ScriptedProvider provider = ScriptedProvider.scripted("llm",
            "Here you go:\n```plantuml\n" + REPAIRED_SEQUENCE + "\n```");
        DiagramArtifact artifact = draft(VALID_SEQUENCE);
        SyntaxChecker checker = recording(CheckResult.failed("Error line 3: unknown participant Db"), CheckResult.passed());

        // When
        RepairResult result = loop(provider, checker).run(artifact, workspace);

        // Then
        assertThat(result).isInstanceOf(RepairResult.Valid.class);
        assertThat(((RepairResult.Valid) result).repairCalls()).isEqualTo(1);
        assertThat(Files.readString(((RepairResult.Valid) result).sourceFile())).isEqualTo(REPAIRED_SEQUENCE);
        assertThat(provider.prompts()).singleElement().satisfies(prompt -> assertThat(prompt)
            .contains("Error line 3: unknown participant Db")
            .contains(VALID_SEQUENCE)
            .contains("note over Participant"));
        assertThat(artifact.repairAttempts()).extracting(RepairAttempt::resultingText).containsExactly(REPAIRED_SEQUENCE);
    }

    @Test
    void run_checkerAlwaysRejects_stopsAfterRepairBudget() {
        // Given
        ScriptedProvider provider = ScriptedProvider.scripted("llm", REPAIRED_SEQUENCE);
        DiagramArtifact artifact = draft(VALID_SEQUENCE);

        // When
        RepairResult result = loop(provider, recording(CheckResult.failed("Syntax Error?"))).run(artifact, workspace);

        // Then
        assertThat(result).isEqualTo(new RepairResult.Failed("Syntax Error?", 2));
        assertThat(provider.calls()).isEqualTo(2);
        assertThat(checkedFiles).hasSize(3);
        assertThat(artifact.status()).isEqualTo(ArtifactStatus.FAILED);
        assertThat(artifact.failureReason()).isEqualTo("Syntax Error?");
    }

    @Test
    void run_unrepairableDraft_failsWithoutRunningChecker() {
        // Given
        ScriptedProvider provider = ScriptedProvider.scripted("llm", REPAIRED_SEQUENCE);
        DiagramArtifact artifact = draft("participant Api\nApi -> Db");

        // When
        RepairResult result = loop(provider, recording(CheckResult.passed())).run(artifact, workspace);

        // Then
        assertThat(result).isInstanceOf(RepairResult.Failed.class);
        assertThat(((RepairResult.Failed) result).reason()).startsWith("unrepairable:");
        assertThat(checkedFiles).isEmpty();
        assertThat(provider.calls()).isZero();
    }

    @Test
    void run_repairAnswerWithoutDiagram_countsAsAttempt() {
        // Given
        ScriptedProvider provider = ScriptedProvider.scripted("llm", "I am not able to fix this diagram.");
        DiagramArtifact artifact = draft(VALID_SEQUENCE);

        // When
        RepairResult result = loop(provider, recording(CheckResult.failed("bad arrow"))).run(artifact, workspace);

        // Then
        assertThat(result).isInstanceOf(RepairResult.Failed.class);
        assertThat(((RepairResult.Failed) result).repairCalls()).isEqualTo(2);
        assertThat(((RepairResult.Failed) result).reason()).contains("no usable diagram").contains("bad arrow");
        assertThat(checkedFiles).hasSize(1);
    }

    @Test
    void run_providersExhaustedDuringRepair_failsImmediately() {
        // Given
        DiagramArtifact artifact = draft(VALID_SEQUENCE);

        // When
        RepairResult result = loop(null, recording(CheckResult.failed("bad arrow"))).run(artifact, workspace);

        // Then
        assertThat(result).isInstanceOf(RepairResult.Failed.class);
        assertThat(((RepairResult.Failed) result).reason()).startsWith("repair call failed");
        assertThat(((RepairResult.Failed) result).repairCalls()).isEqualTo(1);
    }

    @Test
    void run_zeroRepairBudget_failsOnFirstRejection() {
        // Given
        ScriptedProvider provider = ScriptedProvider.scripted("llm", REPAIRED_SEQUENCE);
        DiagramArtifact artifact = new DiagramArtifact(DiagramType.SEQUENCE, "x-sequence", 0);
        artifact.setRawText(VALID_SEQUENCE);

        // When
        RepairResult result = loop(provider, recording(CheckResult.failed("bad"))).run(artifact, workspace);

        // Then
        assertThat(result).isEqualTo(new RepairResult.Failed("bad", 0));
        assertThat(provider.calls()).isZero();
    }

    @Test
    void run_scratchDirectoryBlocked_failsArtifact() throws IOException {
        // Given
        Files.writeString(workspace.resolve("diagrams"), "a file where the directory should be");
        DiagramArtifact artifact = draft(VALID_SEQUENCE);

        // When
        RepairResult result = loop(null, recording(CheckResult.passed())).run(artifact, workspace);

        // Then
        assertThat(result).isInstanceOf(RepairResult.Failed.class);
        assertThat(((RepairResult.Failed) result).reason()).startsWith("could not write");
        assertThat(artifact.status()).isEqualTo(ArtifactStatus.FAILED);
    }
}
