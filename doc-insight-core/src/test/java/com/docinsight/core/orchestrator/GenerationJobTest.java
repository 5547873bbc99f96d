package com.docinsight.core.orchestrator;

import com.docinsight.core.model.EntityInfo;
import com.docinsight.core.model.GenerationRequest;
import com.docinsight.core.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GenerationJob}.
 */
class GenerationJobTest {

    private final GenerationJob job = new GenerationJob(
        new GenerationRequest(new EntityInfo("OrderService", null, List.of()), null, null));

    @Test
    void transitionTo_happyPath_reachesWritten() {
        job.transitionTo(JobStatus.CONTENT_DRAFT);
        job.transitionTo(JobStatus.DIAGRAMS_IN_FLIGHT);
        job.transitionTo(JobStatus.CONTENT_FINAL);
        job.transitionTo(JobStatus.WRITTEN);

        assertThat(job.status()).isEqualTo(JobStatus.WRITTEN);
    }

    @Test
    void transitionTo_skippingDraft_throwsException() {
        assertThatThrownBy(() -> job.transitionTo(JobStatus.DIAGRAMS_IN_FLIGHT))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cannot go from IDLE to DIAGRAMS_IN_FLIGHT");
    }

    @Test
    void transitionTo_fromTerminalState_throwsException() {
        job.transitionTo(JobStatus.SKIPPED);

        assertThatThrownBy(() -> job.transitionTo(JobStatus.CONTENT_DRAFT))
            .isInstanceOf(IllegalStateException.class);
    }
}
