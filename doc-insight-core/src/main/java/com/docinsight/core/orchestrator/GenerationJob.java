package com.docinsight.core.orchestrator;

import com.docinsight.core.model.GenerationRequest;
import com.docinsight.core.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory state of one generation request. Never persisted; its terminal state survives
 * only in the returned {@link com.docinsight.core.model.GenerationResult}.
 */
class GenerationJob {

    private static final Logger log = LoggerFactory.getLogger(GenerationJob.class);

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        TRANSITIONS.put(JobStatus.IDLE, EnumSet.of(JobStatus.CONTENT_DRAFT, JobStatus.SKIPPED));
        TRANSITIONS.put(JobStatus.CONTENT_DRAFT, EnumSet.of(JobStatus.DIAGRAMS_IN_FLIGHT, JobStatus.FAILED));
        TRANSITIONS.put(JobStatus.DIAGRAMS_IN_FLIGHT, EnumSet.of(JobStatus.CONTENT_FINAL, JobStatus.FAILED));
        TRANSITIONS.put(JobStatus.CONTENT_FINAL,
            EnumSet.of(JobStatus.WRITTEN, JobStatus.ROLLED_BACK, JobStatus.FAILED));
    }

    private final GenerationRequest request;
    private JobStatus status = JobStatus.IDLE;
    private String draftContent;
    private String finalContent;

    GenerationJob(GenerationRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    GenerationRequest request() {
        return request;
    }

    JobStatus status() {
        return status;
    }

    String draftContent() {
        return draftContent;
    }

    void setDraftContent(String draftContent) {
        this.draftContent = draftContent;
    }

    String finalContent() {
        return finalContent;
    }

    void setFinalContent(String finalContent) {
        this.finalContent = finalContent;
    }

    /**
     * Moves the job to its next state.
     *
     * @param next next status
     * @throws IllegalStateException if the transition is not allowed
     */
    void transitionTo(JobStatus next) {
        if (!TRANSITIONS.getOrDefault(status, Set.of()).contains(next)) {
            throw new IllegalStateException("Job for " + request.entity().name() + " cannot go from "
                + status + " to " + next);
        }
        log.debug("Job {}: {} -> {}", request.entity().name(), status, next);
        status = next;
    }
}
