package com.docinsight.core.repair;

import com.docinsight.core.model.ArtifactStatus;
import com.docinsight.core.provider.CompletionGateway;
import com.docinsight.core.provider.CompletionResult;
import com.docinsight.core.util.FileUtils;
import com.docinsight.core.validator.DiagramSyntax;
import com.docinsight.core.validator.PlantUmlValidator;
import com.docinsight.core.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a generated diagram into one the external syntax checker accepts, or gives up.
 *
 * <p>State progression of the {@link DiagramArtifact}:
 * <pre>
 * DRAFT -> SYNTAX_CHECKED -> VALID
 *                         -> REPAIRING -> SYNTAX_CHECKED -> ... -> VALID | FAILED
 * </pre>
 * <ul>
 *   <li>The draft goes through {@link PlantUmlValidator} first; text it cannot fix fails
 *       immediately without running the checker.</li>
 *   <li>A rejected diagram is sent back to a provider with the checker diagnostic and
 *       type-specific guidance. The answer is validated and checked again.</li>
 *   <li>At most {@code maxRepairAttempts} repair calls are made per artifact. A repair
 *       answer without a usable diagram counts as an attempt.</li>
 *   <li>If every provider is exhausted during a repair, the artifact fails at once.</li>
 * </ul>
 *
 * <p>The checked file is written to {@code <workspace>/diagrams/<name>.puml}. Instances hold
 * no per-artifact state and may be shared between concurrent diagram tasks.
 */
public class ArtifactRepairLoop {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRepairLoop.class);

    private final CompletionGateway gateway;
    private final PlantUmlValidator validator;
    private final SyntaxChecker checker;
    private final RepairPromptBuilder promptBuilder;

    public ArtifactRepairLoop(CompletionGateway gateway, PlantUmlValidator validator,
                              SyntaxChecker checker, RepairPromptBuilder promptBuilder) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.checker = Objects.requireNonNull(checker, "checker must not be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
    }

    /**
     * Runs the loop for a draft artifact.
     *
     * @param artifact artifact in {@code DRAFT} status with raw text set
     * @param workspace scratch directory for the checked file
     * @return valid text and file, or the failure reason
     */
    public RepairResult run(DiagramArtifact artifact, Path workspace) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        Objects.requireNonNull(artifact.rawText(), "artifact raw text must not be null");
        DiagramSyntax syntax = DiagramSyntax.of(artifact.type());
        Path sourceFile = workspace.resolve("diagrams").resolve(artifact.name() + ".puml");

        ValidationResult validation = validator.check(artifact.rawText(), syntax);
        if (validation instanceof ValidationResult.Unrepairable unrepairable) {
            log.warn("Diagram {} is unrepairable by rules: {}", artifact.name(), unrepairable.reason());
            return fail(artifact, "unrepairable: " + unrepairable.reason());
        }

        try {
            return repair(artifact, ((ValidationResult.Fixed) validation).fixedText(), syntax, sourceFile);
        } catch (IOException e) {
            log.warn("Cannot write scratch file {}: {}", sourceFile, e.getMessage());
            return fail(artifact, "could not write " + sourceFile.getFileName() + ": " + e.getMessage());
        }
    }

    private RepairResult repair(DiagramArtifact artifact, String validText, DiagramSyntax syntax, Path sourceFile)
            throws IOException {
        String text = validText;
        CheckResult check = writeAndCheck(artifact, text, sourceFile);

        while (!check.valid()) {
            if (!artifact.canRepair()) {
                log.warn("Diagram {} still invalid after {} repair attempts", artifact.name(),
                    artifact.repairAttempts().size());
                return fail(artifact, check.diagnostic());
            }

            artifact.transitionTo(ArtifactStatus.REPAIRING);
            int attempt = artifact.repairAttempts().size() + 1;
            log.info("Repairing {} diagram {} (attempt {}/{})", artifact.type().slug(), artifact.name(), attempt,
                artifact.maxRepairAttempts());

            String prompt = promptBuilder.build(artifact.type(), text, check.diagnostic());
            CompletionResult completion = gateway.invoke(prompt);
            if (completion instanceof CompletionResult.Err err) {
                artifact.addRepairAttempt(new RepairAttempt(attempt, check.diagnostic(), null));
                return fail(artifact, "repair call failed: " + err.detail());
            }

            String response = ((CompletionResult.Ok) completion).text();
            Optional<String> repaired = PlantUmlValidator.extractDiagram(response)
                .flatMap(diagram -> validator.check(diagram, syntax).text());
            artifact.addRepairAttempt(new RepairAttempt(attempt, check.diagnostic(), repaired.orElse(null)));

            if (repaired.isEmpty()) {
                log.warn("Repair attempt {} for {} returned no usable diagram", attempt, artifact.name());
                artifact.transitionTo(ArtifactStatus.SYNTAX_CHECKED);
                check = CheckResult.failed("repair returned no usable diagram; previous error: " + check.diagnostic());
                continue;
            }

            text = repaired.get();
            check = writeAndCheck(artifact, text, sourceFile);
        }

        artifact.setValidatedText(text);
        artifact.setSourceFile(sourceFile);
        artifact.transitionTo(ArtifactStatus.VALID);
        int calls = artifact.repairAttempts().size();
        log.info("Diagram {} valid after {} repair attempt(s)", artifact.name(), calls);
        return new RepairResult.Valid(text, sourceFile, calls);
    }

    private CheckResult writeAndCheck(DiagramArtifact artifact, String text, Path sourceFile) throws IOException {
        FileUtils.writeAtomically(sourceFile, text);
        CheckResult result = checker.check(sourceFile);
        artifact.transitionTo(ArtifactStatus.SYNTAX_CHECKED);
        return result;
    }

    private static RepairResult fail(DiagramArtifact artifact, String reason) {
        artifact.fail(reason);
        return new RepairResult.Failed(reason, artifact.repairAttempts().size());
    }
}
