package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.model.event.ProgressEvent;
import com.learnflow.learnflow_backend.model.event.ProgressEventType;
import com.learnflow.learnflow_backend.model.roadmap.ValidationIssue;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.support.Fixtures;
import com.learnflow.learnflow_backend.support.RecordingNotifications;
import org.junit.jupiter.api.Test;

import static com.learnflow.learnflow_backend.support.Fixtures.ROADMAP_ID;
import static org.assertj.core.api.Assertions.assertThat;

class HumanReviewExecutorTest {

    private final RecordingNotifications notifications = new RecordingNotifications();
    private final HumanReviewExecutor executor = new HumanReviewExecutor(notifications);

    @Test
    void parksTheRunAndAnnouncesTheReview() {
        WorkflowState state = Fixtures.state("run-1", WorkflowConfig.defaults());
        state.apply(StateDelta.builder()
                .roadmapId(ROADMAP_ID)
                .framework(Fixtures.framework(ROADMAP_ID, 2))
                .validationResult(ValidationResult.failed(
                        new ValidationIssue("medium", "stage 1", "pacing"),
                        new ValidationIssue("low", "module m1", "naming")))
                .validationExhausted(true)
                .build());

        StageResult result = executor.execute(state);

        assertThat(result.suspended()).isTrue();
        assertThat(result.awaitReason()).isEqualTo(AwaitReason.HUMAN_REVIEW);
        assertThat(result.delta().getHistoryEntry()).contains("exhausted");

        ProgressEvent event = notifications.ofType(ProgressEventType.HUMAN_REVIEW_REQUIRED).get(0);
        assertThat(event.getData())
                .containsEntry("roadmapId", ROADMAP_ID)
                .containsEntry("validationExhausted", true)
                .containsEntry("openIssues", 2);
    }
}
