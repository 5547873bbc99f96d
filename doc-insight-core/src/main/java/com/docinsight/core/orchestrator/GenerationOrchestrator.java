package com.docinsight.core.orchestrator;

import com.docinsight.core.config.ProjectConfig;
import com.docinsight.core.config.ProjectConfig.GenerationSettings;
import com.docinsight.core.generator.DiagramPromptBuilder;
import com.docinsight.core.generator.DiagramReference;
import com.docinsight.core.generator.DiagramTask;
import com.docinsight.core.generator.NarrativeComposer;
import com.docinsight.core.generator.NarrativePromptBuilder;
import com.docinsight.core.model.ArtifactStatus;
import com.docinsight.core.model.DiagramOutcome;
import com.docinsight.core.model.DiagramType;
import com.docinsight.core.model.GenerationRequest;
import com.docinsight.core.model.GenerationResult;
import com.docinsight.core.model.JobFailure;
import com.docinsight.core.model.JobStatus;
import com.docinsight.core.model.SignificanceDiagnostics;
import com.docinsight.core.provider.CompletionGateway;
import com.docinsight.core.provider.CompletionResult;
import com.docinsight.core.provider.Sleeper;
import com.docinsight.core.repair.ArtifactRepairLoop;
import com.docinsight.core.repair.DiagramArtifact;
import com.docinsight.core.repair.DiagramRenderer;
import com.docinsight.core.repair.PlantUmlRenderer;
import com.docinsight.core.repair.PlantUmlSyntaxChecker;
import com.docinsight.core.repair.ProcessRunner;
import com.docinsight.core.repair.RepairPromptBuilder;
import com.docinsight.core.repair.SyntaxChecker;
import com.docinsight.core.util.FileUtils;
import com.docinsight.core.util.Names;
import com.docinsight.core.validator.PlantUmlValidator;
import com.docinsight.core.writer.ArtifactWriter;
import com.docinsight.core.writer.FileSystemArtifactWriter;
import com.docinsight.core.writer.GeneratedFile;
import com.docinsight.core.writer.GeneratedOutput;
import com.docinsight.core.writer.WriteContext;
import com.docinsight.core.writer.WriteFailedException;
import com.docinsight.core.writer.WriteReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one generation job from significance gating to written files.
 *
 * <p><b>Sequence:</b>
 * <ol>
 *   <li>Gate: if no pattern reaches the significance threshold the job is {@code SKIPPED}
 *       without any provider call.</li>
 *   <li>Draft: the narrative insight is requested from the gateway. Failure or an empty
 *       answer ends the job with {@code CONTENT_GENERATION_FAILED}; no diagram work starts
 *       and nothing is written.</li>
 *   <li>Diagrams: one {@link DiagramTask} per configured type runs on a pool sized to the
 *       type count. All tasks are joined; a failed diagram never fails the job.</li>
 *   <li>Final: the narrative is composed with links to the valid diagrams only.</li>
 *   <li>Write: stale diagram files of the entity are removed, then the
 *       {@link ArtifactWriter} persists everything. A failed narrative write rolls back the
 *       job's diagram files.</li>
 * </ol>
 *
 * <p>Diagram tasks work in a per-job scratch directory; the output directory is only
 * touched by the writer after the join.
 */
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final GenerationSettings settings;
    private final Path outputDirectory;
    private final CompletionGateway gateway;
    private final DiagramRenderer renderer;
    private final ArtifactWriter writer;
    private final SignificanceGate gate;
    private final ArtifactRepairLoop repairLoop;
    private final DiagramPromptBuilder diagramPrompts;
    private final NarrativePromptBuilder narrativePrompts = new NarrativePromptBuilder();
    private final NarrativeComposer composer = new NarrativeComposer();

    /**
     * Creates an orchestrator.
     *
     * @param settings generation settings
     * @param styleInclude style sheet included by every diagram, or null
     * @param outputDirectory output directory
     * @param gateway completion gateway
     * @param checker external syntax checker
     * @param renderer image renderer, or null to skip rendering
     * @param writer artifact writer
     */
    public GenerationOrchestrator(GenerationSettings settings, String styleInclude, Path outputDirectory,
                                  CompletionGateway gateway, SyntaxChecker checker, DiagramRenderer renderer,
                                  ArtifactWriter writer) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.renderer = settings.renderImages() ? renderer : null;
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.gate = new SignificanceGate(settings.significanceThreshold());
        this.repairLoop = new ArtifactRepairLoop(gateway, new PlantUmlValidator(),
            Objects.requireNonNull(checker, "checker must not be null"), new RepairPromptBuilder());
        this.diagramPrompts = new DiagramPromptBuilder(styleInclude);
    }

    /**
     * Creates an orchestrator that uses the PlantUML command line and writes to the filesystem.
     *
     * @param config project configuration
     * @param gateway completion gateway
     * @return orchestrator
     */
    public static GenerationOrchestrator create(ProjectConfig config, CompletionGateway gateway) {
        GenerationSettings generation = config.generation();
        ProjectConfig.PlantUmlSettings plantuml = config.plantuml();
        ProcessRunner runner = new ProcessRunner();

        SyntaxChecker checker = new PlantUmlSyntaxChecker(plantuml.command(), runner, generation.subprocessTimeout());
        DiagramRenderer renderer = new PlantUmlRenderer(plantuml.command(), runner, generation.subprocessTimeout(),
            plantuml.renderPollInterval(), plantuml.renderPollAttempts(), Sleeper.system());

        return new GenerationOrchestrator(generation, plantuml.styleInclude(), Path.of(config.output().directory()),
            gateway, checker, renderer, new FileSystemArtifactWriter());
    }

    /**
     * Runs a generation job.
     *
     * @param request what to document
     * @return terminal result with counts and per-diagram outcomes
     */
    public GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        long start = System.nanoTime();
        GenerationJob job = new GenerationJob(request);
        String entityName = request.entity().name();

        SignificanceDiagnostics diagnostics = gate.evaluate(request.patterns());
        if (!diagnostics.qualifies()) {
            log.info("Skipping {}: none of {} pattern(s) reach significance {}", entityName,
                diagnostics.patternsAnalyzed(), diagnostics.threshold());
            job.transitionTo(JobStatus.SKIPPED);
            return new GenerationResult(entityName, JobStatus.SKIPPED, null, null, null, List.of(), diagnostics,
                elapsedSince(start));
        }

        job.transitionTo(JobStatus.CONTENT_DRAFT);
        CompletionResult draft = gateway.invoke(narrativePrompts.build(request));
        String insight = draft instanceof CompletionResult.Ok ok ? composer.cleanInsight(ok.text()) : "";
        if (insight.isBlank()) {
            String reason = draft instanceof CompletionResult.Err err
                ? "narrative draft failed: " + err.detail()
                : "narrative draft was empty";
            log.error("Aborting {}: {}", entityName, reason);
            job.transitionTo(JobStatus.FAILED);
            return failed(entityName, JobFailure.CONTENT_GENERATION_FAILED, reason, diagnostics, start);
        }
        job.setDraftContent(insight);

        Path workspace;
        try {
            workspace = Files.createTempDirectory("doc-insight-");
        } catch (IOException e) {
            job.transitionTo(JobStatus.FAILED);
            return failed(entityName, JobFailure.WRITE_FAILED, "cannot create scratch directory: " + e.getMessage(),
                diagnostics, start);
        }

        try {
            return generateWithDiagrams(job, diagnostics, workspace, start);
        } finally {
            FileUtils.deleteRecursively(workspace);
        }
    }

    private GenerationResult generateWithDiagrams(GenerationJob job, SignificanceDiagnostics diagnostics,
                                                  Path workspace, long start) {
        GenerationRequest request = job.request();
        String entityName = request.entity().name();
        String slug = Names.toKebabCase(entityName);

        job.transitionTo(JobStatus.DIAGRAMS_IN_FLIGHT);
        List<DiagramArtifact> artifacts = runDiagramTasks(request, slug, workspace);
        List<DiagramArtifact> valid = artifacts.stream().filter(DiagramArtifact::isValid).collect(Collectors.toList());
        log.info("{}: {}/{} diagram(s) valid", entityName, valid.size(), artifacts.size());

        job.transitionTo(JobStatus.CONTENT_FINAL);
        Function<Set<DiagramType>, String> narrativeFor = written -> composer.compose(request.entity(),
            request.relations(), job.draftContent(), valid.stream()
                .filter(a -> written.contains(a.type()))
                .map(a -> new DiagramReference(a.type(), a.name(), a.imageFile() != null))
                .collect(Collectors.toList()));

        WriteContext context = WriteContext.of(outputDirectory);
        Set<DiagramType> keep = valid.stream().map(DiagramArtifact::type)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(DiagramType.class)));
        writer.removeStaleDiagrams(context, slug, keep);
        job.setFinalContent(narrativeFor.apply(keep));

        WriteReceipt receipt;
        try {
            receipt = writer.write(toOutput(slug, entityName, job.finalContent(), narrativeFor, valid), context);
        } catch (WriteFailedException e) {
            log.error("Write failed for {}: {} ({} diagram file(s) rolled back)", entityName, e.getMessage(),
                e.rolledBack().size());
            job.transitionTo(JobStatus.ROLLED_BACK);
            return new GenerationResult(entityName, JobStatus.ROLLED_BACK, JobFailure.WRITE_FAILED, e.getMessage(),
                null, outcomes(artifacts, null), diagnostics, elapsedSince(start));
        }

        job.transitionTo(JobStatus.WRITTEN);
        GenerationResult result = new GenerationResult(entityName, JobStatus.WRITTEN, null, null,
            receipt.narrativeFile(), outcomes(artifacts, receipt), diagnostics, elapsedSince(start));
        log.info("Generated {}: {} diagram(s) written, {} failed, in {}ms", entityName, result.successfulDiagrams(),
            result.failedDiagrams(), result.processingTime().toMillis());
        return result;
    }

    private List<DiagramArtifact> runDiagramTasks(GenerationRequest request, String slug, Path workspace) {
        List<DiagramType> types = settings.resolvedDiagramTypes();
        List<DiagramTask> tasks = types.stream()
            .map(type -> new DiagramTask(type, request, slug, gateway, diagramPrompts, repairLoop, renderer,
                workspace, settings.maxRepairAttempts()))
            .collect(Collectors.toList());

        ExecutorService pool = Executors.newFixedThreadPool(types.size());
        try {
            List<Future<DiagramArtifact>> futures = pool.invokeAll(tasks);
            List<DiagramArtifact> artifacts = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                artifacts.add(await(futures.get(i), tasks.get(i), slug));
            }
            return artifacts;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for diagram tasks of {}", slug);
            return tasks.stream()
                .map(task -> failedArtifact(task.type(), slug, "interrupted"))
                .collect(Collectors.toList());
        } finally {
            pool.shutdownNow();
        }
    }

    private DiagramArtifact await(Future<DiagramArtifact> future, DiagramTask task, String slug)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} diagram task failed unexpectedly", task.type().slug(), cause);
            return failedArtifact(task.type(), slug, "task failed: " + cause.getMessage());
        }
    }

    private DiagramArtifact failedArtifact(DiagramType type, String slug, String reason) {
        DiagramArtifact artifact = new DiagramArtifact(type, slug + "-" + type.slug(), settings.maxRepairAttempts());
        artifact.fail(reason);
        return artifact;
    }

    private static GeneratedOutput toOutput(String slug, String entityName, String narrative,
                                            Function<Set<DiagramType>, String> narrativeFor,
                                            List<DiagramArtifact> valid) {
        List<GeneratedOutput.DiagramFiles> diagrams = valid.stream()
            .map(a -> new GeneratedOutput.DiagramFiles(
                a.type(),
                GeneratedFile.text(FileSystemArtifactWriter.DIAGRAMS_DIR + "/" + a.name() + ".puml",
                    a.validatedText(), "text/x-plantuml"),
                a.imageFile() == null ? null : GeneratedFile.copyOf(
                    FileSystemArtifactWriter.IMAGES_DIR + "/" + a.name() + ".png", a.imageFile(), "image/png")))
            .collect(Collectors.toList());
        String fileName = Names.toFileName(entityName, slug.isEmpty() ? "insight" : slug) + ".md";
        return new GeneratedOutput(slug, GeneratedFile.text(fileName, narrative, "text/markdown"), diagrams,
            narrativeFor);
    }

    private static List<DiagramOutcome> outcomes(List<DiagramArtifact> artifacts, WriteReceipt receipt) {
        Map<DiagramType, String> omitted = receipt == null ? Map.of() : receipt.omitted();
        List<DiagramOutcome> outcomes = new ArrayList<>(artifacts.size());
        for (DiagramArtifact artifact : artifacts) {
            int repairs = artifact.repairAttempts().size();
            if (!artifact.isValid()) {
                outcomes.add(new DiagramOutcome(artifact.type(), ArtifactStatus.FAILED, null, null, repairs,
                    artifact.failureReason()));
            } else if (receipt == null) {
                outcomes.add(new DiagramOutcome(artifact.type(), ArtifactStatus.VALID, null, null, repairs,
                    "rolled back"));
            } else if (omitted.containsKey(artifact.type())) {
                outcomes.add(new DiagramOutcome(artifact.type(), ArtifactStatus.VALID, null, null, repairs,
                    omitted.get(artifact.type())));
            } else {
                WriteReceipt.WrittenDiagram written = receipt.diagram(artifact.type()).orElse(null);
                outcomes.add(new DiagramOutcome(artifact.type(), ArtifactStatus.VALID,
                    written == null ? null : written.sourceFile(),
                    written == null ? null : written.imageFile(), repairs, null));
            }
        }
        return outcomes;
    }

    private static GenerationResult failed(String entityName, JobFailure failure, String message,
                                           SignificanceDiagnostics diagnostics, long start) {
        return new GenerationResult(entityName, JobStatus.FAILED, failure, message, null, List.of(), diagnostics,
            elapsedSince(start));
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
