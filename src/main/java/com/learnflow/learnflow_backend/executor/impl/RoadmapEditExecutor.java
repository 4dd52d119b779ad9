package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.executor.agent.Agent;
import com.learnflow.learnflow_backend.executor.agent.AgentException;
import com.learnflow.learnflow_backend.model.roadmap.EditRequest;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.ValidationIssue;
import com.learnflow.learnflow_backend.model.workflow.EditSource;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Revises the roadmap after either a failed validation or a rejected review.
 * The revised framework replaces the stored one under the same roadmap id.
 */
@Slf4j
@Component
public class RoadmapEditExecutor implements StageExecutor {

    private final Agent<EditRequest, RoadmapFramework> roadmapEditor;
    private final WorkflowStore store;
    private final TransientRetry retry;

    public RoadmapEditExecutor(Agent<EditRequest, RoadmapFramework> roadmapEditor,
                               WorkflowStore store,
                               TransientRetry retry) {
        this.roadmapEditor = roadmapEditor;
        this.store = store;
        this.retry = retry;
    }

    @Override
    public WorkflowStage supportedStage() {
        return WorkflowStage.ROADMAP_EDIT;
    }

    @Override
    public StageResult execute(WorkflowState state) {
        EditSource source = state.getEditSource() != null ? state.getEditSource() : EditSource.VALIDATION_FAILED;
        List<ValidationIssue> issues = source == EditSource.VALIDATION_FAILED && state.getValidationResult() != null
                ? state.getValidationResult().getIssues()
                : List.of();
        String feedback = source == EditSource.HUMAN_REVIEW ? state.getReviewFeedback() : null;

        RoadmapFramework revised = roadmapEditor.execute(new EditRequest(state.getFramework(), source, issues, feedback,
                state.getUserRequest() != null ? state.getUserRequest().getPreferences() : null));
        if (revised == null || revised.allConcepts().isEmpty()) {
            throw new AgentException(roadmapEditor.name(), "revised framework has no concepts");
        }
        String roadmapId = state.getRoadmapId();
        revised.setRoadmapId(roadmapId);
        CurriculumDesignExecutor.prefixConceptIds(revised, roadmapId);

        String userId = state.getUserRequest() != null ? state.getUserRequest().getUserId() : null;
        retry.run("save roadmap " + roadmapId, () -> store.saveRoadmap(state.getRunId(), userId, revised));

        log.info("[ENGINE] runId={} roadmap {} edited (source={}, issues={}, feedback={})",
                state.getRunId(), roadmapId, source, issues.size(), feedback != null);
        return StageResult.advance(StateDelta.builder()
                .framework(revised)
                .historyEntry("roadmap_edit: " + source.name().toLowerCase())
                .build());
    }
}
