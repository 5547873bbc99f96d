package com.docinsight.core.repair;

import com.docinsight.core.model.ArtifactStatus;
import com.docinsight.core.model.DiagramType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Working state of one diagram within a job.
 *
 * <p>Owned by a single diagram task and discarded when the job completes. The file paths
 * point into the job's scratch workspace, never the output directory.
 */
public class DiagramArtifact {

    private static final Logger log = LoggerFactory.getLogger(DiagramArtifact.class);

    private final DiagramType type;
    private final String name;
    private final int maxRepairAttempts;
    private final List<RepairAttempt> repairAttempts = new ArrayList<>();

    private ArtifactStatus status = ArtifactStatus.DRAFT;
    private String rawText;
    private String validatedText;
    private Path sourceFile;
    private Path imageFile;
    private String failureReason;

    /**
     * Creates a draft artifact.
     *
     * @param type diagram type
     * @param name file base name, e.g. "order-service-sequence"
     * @param maxRepairAttempts upper bound on recorded repair attempts
     */
    public DiagramArtifact(DiagramType type, String name, int maxRepairAttempts) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (maxRepairAttempts < 0) {
            throw new IllegalArgumentException("maxRepairAttempts must not be negative");
        }
        this.maxRepairAttempts = maxRepairAttempts;
    }

    public DiagramType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public ArtifactStatus status() {
        return status;
    }

    public String rawText() {
        return rawText;
    }

    public String validatedText() {
        return validatedText;
    }

    public Path sourceFile() {
        return sourceFile;
    }

    public Path imageFile() {
        return imageFile;
    }

    public String failureReason() {
        return failureReason;
    }

    public List<RepairAttempt> repairAttempts() {
        return List.copyOf(repairAttempts);
    }

    public int maxRepairAttempts() {
        return maxRepairAttempts;
    }

    public boolean isValid() {
        return status == ArtifactStatus.VALID;
    }

    public boolean canRepair() {
        return repairAttempts.size() < maxRepairAttempts;
    }

    public void setRawText(String rawText) {
        this.rawText = rawText;
    }

    public void setValidatedText(String validatedText) {
        this.validatedText = validatedText;
    }

    public void setSourceFile(Path sourceFile) {
        this.sourceFile = sourceFile;
    }

    /**
     * Records a rendered image. Only valid artifacts may be rendered.
     *
     * @param imageFile rendered image in the scratch workspace
     */
    public void setImageFile(Path imageFile) {
        if (imageFile != null && status != ArtifactStatus.VALID) {
            throw new IllegalStateException("Only valid diagrams can be rendered, " + name + " is " + status);
        }
        this.imageFile = imageFile;
    }

    /**
     * Records a repair attempt.
     *
     * @param attempt attempt to record
     * @throws IllegalStateException if the repair bound is already reached
     */
    public void addRepairAttempt(RepairAttempt attempt) {
        if (!canRepair()) {
            throw new IllegalStateException("Repair limit of " + maxRepairAttempts + " reached for " + name);
        }
        repairAttempts.add(Objects.requireNonNull(attempt, "attempt must not be null"));
    }

    /**
     * Moves the artifact to a new status.
     *
     * @param next next status
     * @throws IllegalStateException if the artifact is already valid or failed
     */
    public void transitionTo(ArtifactStatus next) {
        if (status == ArtifactStatus.VALID || status == ArtifactStatus.FAILED) {
            throw new IllegalStateException("Diagram " + name + " is already " + status);
        }
        log.debug("Diagram {}: {} -> {}", name, status, next);
        status = next;
    }

    /**
     * Marks the artifact failed.
     *
     * @param reason failure reason
     */
    public void fail(String reason) {
        transitionTo(ArtifactStatus.FAILED);
        this.failureReason = reason;
    }
}
