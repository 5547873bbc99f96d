package com.docinsight.core.generator;

import com.docinsight.core.model.ArtifactStatus;
import com.docinsight.core.model.DiagramType;
import com.docinsight.core.model.EntityInfo;
import com.docinsight.core.model.GenerationRequest;
import com.docinsight.core.provider.CompletionGateway;
import com.docinsight.core.provider.ProviderRecord;
import com.docinsight.core.provider.ProviderRegistry;
import com.docinsight.core.provider.ScriptedProvider;
import com.docinsight.core.repair.ArtifactRepairLoop;
import com.docinsight.core.repair.CheckResult;
import com.docinsight.core.repair.DiagramArtifact;
import com.docinsight.core.repair.DiagramRenderer;
import com.docinsight.core.repair.RepairPromptBuilder;
import com.docinsight.core.validator.PlantUmlValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagramTask}.
 */
class DiagramTaskTest {

    private static final String DIAGRAM = "@startuml\nparticipant Api\nApi -> Db: query\n@enduml";

    @TempDir
    Path workspace;

    private final GenerationRequest request = new GenerationRequest(
        new EntityInfo("OrderService", "Service", List.of("Handles orders")), List.of(), List.of());

    private CompletionGateway gateway;

    @AfterEach
    void tearDown() {
        if (gateway != null) {
            gateway.close();
        }
    }

    private DiagramTask task(ScriptedProvider provider, DiagramRenderer renderer) {
        ProviderRegistry registry = provider == null
            ? ProviderRegistry.empty()
            : ProviderRegistry.builder().register(ProviderRecord.withDefaults(provider.id(), 1), provider).build();
        gateway = new CompletionGateway(registry, duration -> { });
        ArtifactRepairLoop loop = new ArtifactRepairLoop(gateway, new PlantUmlValidator(),
            sourceFile -> CheckResult.passed(), new RepairPromptBuilder());
        return new DiagramTask(DiagramType.SEQUENCE, request, "order-service", gateway,
            new DiagramPromptBuilder(null), loop, renderer, workspace, 2);
    }

    @Test
    void call_validDiagramRendered_recordsImage() {
        // Given
        ScriptedProvider provider = ScriptedProvider.scripted("llm", "```plantuml\n" + DIAGRAM + "\n```");
        DiagramRenderer renderer = (source, imageDir) -> {
            try {
                Files.createDirectories(imageDir);
                return Optional.of(Files.writeString(imageDir.resolve("order-service-sequence.png"), "png"));
            } catch (IOException e) {
                return Optional.empty();
            }
        };

        // When
        DiagramArtifact artifact = task(provider, renderer).call();

        // Then
        assertThat(artifact.status()).isEqualTo(ArtifactStatus.VALID);
        assertThat(artifact.name()).isEqualTo("order-service-sequence");
        assertThat(artifact.sourceFile()).isEqualTo(workspace.resolve("diagrams/order-service-sequence.puml"));
        assertThat(artifact.imageFile()).isEqualTo(workspace.resolve("images/order-service-sequence.png"));
        assertThat(provider.prompts()).hasSize(1);
        assertThat(provider.prompts().get(0)).contains("PlantUML sequence diagram");
    }

    @Test
    void call_rendererProducesNothing_validWithoutImage() {
        ScriptedProvider provider = ScriptedProvider.scripted("llm", DIAGRAM);

        DiagramArtifact artifact = task(provider, (source, imageDir) -> Optional.empty()).call();

        assertThat(artifact.isValid()).isTrue();
        assertThat(artifact.imageFile()).isNull();
    }

    @Test
    void call_responseWithoutDiagram_fails() {
        ScriptedProvider provider = ScriptedProvider.scripted("llm", "Sorry, I cannot help with that.");

        DiagramArtifact artifact = task(provider, null).call();

        assertThat(artifact.status()).isEqualTo(ArtifactStatus.FAILED);
        assertThat(artifact.failureReason()).contains("no @startuml/@enduml block");
    }

    @Test
    void call_providersExhausted_failsWithGenerationReason() {
        DiagramArtifact artifact = task(null, null).call();

        assertThat(artifact.status()).isEqualTo(ArtifactStatus.FAILED);
        assertThat(artifact.failureReason()).startsWith("generation failed:");
    }
}
