package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.model.roadmap.EditRequest;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.ValidationIssue;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import com.learnflow.learnflow_backend.model.workflow.EditSource;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.support.Fixtures;
import com.learnflow.learnflow_backend.support.InMemoryWorkflowStore;
import com.learnflow.learnflow_backend.support.StubAgent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.learnflow.learnflow_backend.support.Fixtures.ROADMAP_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoadmapEditExecutorTest {

    private final InMemoryWorkflowStore store = new InMemoryWorkflowStore();
    private StubAgent<EditRequest, RoadmapFramework> editor;
    private RoadmapEditExecutor executor;
    private WorkflowState state;

    @BeforeEach
    void setUp() {
        editor = new StubAgent<>("roadmap_editor", r -> Fixtures.framework(ROADMAP_ID, 4));
        executor = new RoadmapEditExecutor(editor, store, TransientRetry.none());
        state = Fixtures.state("run-1", WorkflowConfig.defaults());
        state.apply(StateDelta.builder()
                .roadmapId(ROADMAP_ID)
                .framework(Fixtures.framework(ROADMAP_ID, 3))
                .validationResult(ValidationResult.failed(new ValidationIssue("high", "module m1", "no capstone")))
                .build());
    }

    @Test
    void validationEditSeesTheValidatorIssues() {
        state.apply(StateDelta.builder().editSource(EditSource.VALIDATION_FAILED).build());

        StageResult result = executor.execute(state);

        EditRequest request = editor.inputs().get(0);
        assertEquals(EditSource.VALIDATION_FAILED, request.source());
        assertEquals(1, request.issues().size());
        assertNull(request.reviewerFeedback());
        assertEquals(4, result.delta().getFramework().allConcepts().size());
        assertEquals("roadmap_edit: validation_failed", result.delta().getHistoryEntry());
        assertTrue(store.roadmaps.containsKey(ROADMAP_ID));
    }

    @Test
    void reviewEditSeesTheFeedbackOnly() {
        state.apply(StateDelta.builder()
                .editSource(EditSource.HUMAN_REVIEW)
                .humanApproved(false)
                .reviewFeedback("split the async module")
                .build());

        executor.execute(state);

        EditRequest request = editor.inputs().get(0);
        assertEquals(EditSource.HUMAN_REVIEW, request.source());
        assertTrue(request.issues().isEmpty());
        assertEquals("split the async module", request.reviewerFeedback());
    }

    @Test
    void missingSourceIsTreatedAsValidationFailure() {
        executor.execute(state);

        assertEquals(EditSource.VALIDATION_FAILED, editor.inputs().get(0).source());
    }
}
