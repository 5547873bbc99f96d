package com.docinsight.core.generator;

import com.docinsight.core.model.DiagramType;
import com.docinsight.core.model.GenerationRequest;
import com.docinsight.core.provider.CompletionGateway;
import com.docinsight.core.provider.CompletionResult;
import com.docinsight.core.repair.ArtifactRepairLoop;
import com.docinsight.core.repair.DiagramArtifact;
import com.docinsight.core.repair.DiagramRenderer;
import com.docinsight.core.repair.RepairResult;
import com.docinsight.core.validator.PlantUmlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Produces one diagram: generate, validate and repair, then optionally render.
 *
 * <p>Never throws for expected failures; the returned artifact is either {@code VALID} or
 * {@code FAILED} with a reason. Each task owns its artifact, so concurrent tasks share no
 * mutable state.
 */
public class DiagramTask implements Callable<DiagramArtifact> {

    private static final Logger log = LoggerFactory.getLogger(DiagramTask.class);

    private final DiagramType type;
    private final GenerationRequest request;
    private final String baseName;
    private final CompletionGateway gateway;
    private final DiagramPromptBuilder promptBuilder;
    private final ArtifactRepairLoop repairLoop;
    private final DiagramRenderer renderer;
    private final Path workspace;
    private final int maxRepairAttempts;

    /**
     * Creates a task.
     *
     * @param type diagram type to produce
     * @param request generation request
     * @param slug kebab-case entity name
     * @param gateway completion gateway
     * @param promptBuilder diagram prompt builder
     * @param repairLoop repair loop
     * @param renderer image renderer, or null to skip rendering
     * @param workspace scratch directory of the job
     * @param maxRepairAttempts repair bound per diagram
     */
    public DiagramTask(DiagramType type, GenerationRequest request, String slug, CompletionGateway gateway,
                       DiagramPromptBuilder promptBuilder, ArtifactRepairLoop repairLoop, DiagramRenderer renderer,
                       Path workspace, int maxRepairAttempts) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.baseName = Objects.requireNonNull(slug, "slug must not be null") + "-" + type.slug();
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
        this.repairLoop = Objects.requireNonNull(repairLoop, "repairLoop must not be null");
        this.renderer = renderer;
        this.workspace = Objects.requireNonNull(workspace, "workspace must not be null");
        this.maxRepairAttempts = maxRepairAttempts;
    }

    @Override
    public DiagramArtifact call() {
        DiagramArtifact artifact = new DiagramArtifact(type, baseName, maxRepairAttempts);
        log.info("Generating {} diagram for {}", type.slug(), request.entity().name());

        CompletionResult result = gateway.invoke(promptBuilder.build(type, request));
        if (result instanceof CompletionResult.Err err) {
            artifact.fail("generation failed: " + err.detail());
            return artifact;
        }

        Optional<String> diagram = PlantUmlValidator.extractDiagram(((CompletionResult.Ok) result).text());
        if (diagram.isEmpty()) {
            log.warn("Response for {} diagram contained no @startuml block", type.slug());
            artifact.fail("response contained no @startuml/@enduml block");
            return artifact;
        }
        artifact.setRawText(diagram.get());

        RepairResult repair = repairLoop.run(artifact, workspace);
        if (repair instanceof RepairResult.Valid valid && renderer != null) {
            Optional<Path> image = renderer.render(valid.sourceFile(), workspace.resolve("images"));
            if (image.isPresent()) {
                artifact.setImageFile(image.get());
            } else {
                log.info("Diagram {} validated but not rendered", baseName);
            }
        }
        return artifact;
    }

    public DiagramType type() {
        return type;
    }
}
