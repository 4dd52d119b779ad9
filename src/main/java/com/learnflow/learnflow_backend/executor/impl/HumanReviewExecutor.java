package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.engine.NotificationPort;
import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.model.event.ProgressEvent;
import com.learnflow.learnflow_backend.model.event.ProgressEventType;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import org.springframework.stereotype.Component;

/**
 * Parks the run until a reviewer decides. The decision arrives through
 * {@code WorkflowEngine.resume}, never through this executor.
 */
@Component
public class HumanReviewExecutor implements StageExecutor {

    private final NotificationPort notifications;

    public HumanReviewExecutor(NotificationPort notifications) {
        this.notifications = notifications;
    }

    @Override
    public WorkflowStage supportedStage() {
        return WorkflowStage.HUMAN_REVIEW;
    }

    @Override
    public StageResult execute(WorkflowState state) {
        int issues = state.getValidationResult() != null ? state.getValidationResult().getIssues().size() : 0;
        notifications.publish(state.getRunId(), ProgressEvent.of(ProgressEventType.HUMAN_REVIEW_REQUIRED,
                        WorkflowStage.HUMAN_REVIEW.wireName(), "Roadmap is ready for review")
                .with("roadmapId", state.getRoadmapId())
                .with("validationExhausted", state.isValidationExhausted())
                .with("openIssues", issues));
        return StageResult.suspend(AwaitReason.HUMAN_REVIEW,
                StateDelta.history("human_review: awaiting decision"
                        + (state.isValidationExhausted() ? " (validation retries exhausted)" : "")));
    }
}
