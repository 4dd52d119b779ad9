package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.ValidationIssue;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import com.learnflow.learnflow_backend.model.workflow.EditSource;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;
import java.util.Map;

import static com.learnflow.learnflow_backend.support.Fixtures.ROADMAP_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowRouterTest {

    private final WorkflowRouter router = new WorkflowRouter();

    private static WorkflowConfig config(boolean skipValidation, boolean skipReview, boolean skipContent) {
        return WorkflowConfig.builder()
                .skipValidation(skipValidation)
                .skipHumanReview(skipReview)
                .skipContentGeneration(skipContent)
                .build();
    }

    private static WorkflowState designed(WorkflowConfig config) {
        WorkflowState state = Fixtures.state("run", config);
        state.apply(StateDelta.builder()
                .roadmapId(ROADMAP_ID)
                .framework(Fixtures.framework(ROADMAP_ID, 2))
                .build());
        return state;
    }

    @ParameterizedTest
    @CsvSource({
            "false, false, false, STRUCTURE_VALIDATION",
            "false, true,  false, STRUCTURE_VALIDATION",
            "false, false, true,  STRUCTURE_VALIDATION",
            "false, true,  true,  STRUCTURE_VALIDATION",
            "true,  false, false, HUMAN_REVIEW",
            "true,  false, true,  HUMAN_REVIEW",
            "true,  true,  false, CONTENT_GENERATION",
            "true,  true,  true,  COMPLETED"
    })
    void afterCurriculumDesign(boolean skipValidation, boolean skipReview, boolean skipContent, WorkflowStage expected) {
        WorkflowConfig config = config(skipValidation, skipReview, skipContent);

        Transition t = router.route(WorkflowStage.CURRICULUM_DESIGN, designed(config), config);

        assertEquals(expected, t.next());
    }

    @ParameterizedTest
    @CsvSource({
            "false, false, HUMAN_REVIEW",
            "false, true,  HUMAN_REVIEW",
            "true,  false, CONTENT_GENERATION",
            "true,  true,  COMPLETED"
    })
    void afterPassingValidation(boolean skipReview, boolean skipContent, WorkflowStage expected) {
        WorkflowConfig config = config(false, skipReview, skipContent);
        WorkflowState state = designed(config);
        state.apply(StateDelta.builder().validationResult(ValidationResult.passed()).build());

        assertEquals(expected, router.route(WorkflowStage.STRUCTURE_VALIDATION, state, config).next());
    }

    @Test
    void failedValidationWithRetriesLeftGoesToEditAndCountsTheRetry() {
        WorkflowConfig config = WorkflowConfig.defaults();
        WorkflowState state = designed(config);
        state.apply(StateDelta.builder()
                .validationResult(ValidationResult.failed(new ValidationIssue("high", "stage 1", "gap")))
                .validationRetryCount(1)
                .build());

        Transition t = router.route(WorkflowStage.STRUCTURE_VALIDATION, state, config);

        assertEquals(WorkflowStage.ROADMAP_EDIT, t.next());
        assertEquals(2, t.delta().getValidationRetryCount());
        assertEquals(EditSource.VALIDATION_FAILED, t.delta().getEditSource());
    }

    @Test
    void failedValidationWithoutRetriesLeftFlagsExhaustion() {
        WorkflowConfig config = WorkflowConfig.builder().maxValidationRetries(2).build();
        WorkflowState state = designed(config);
        state.apply(StateDelta.builder()
                .validationResult(ValidationResult.failed(new ValidationIssue("high", "stage 1", "gap")))
                .validationRetryCount(2)
                .build());

        Transition t = router.route(WorkflowStage.STRUCTURE_VALIDATION, state, config);

        assertEquals(WorkflowStage.HUMAN_REVIEW, t.next());
        assertEquals(Boolean.TRUE, t.delta().getValidationExhausted());
        assertNull(t.delta().getValidationRetryCount());
    }

    @Test
    void editAlwaysGoesBackToValidation() {
        WorkflowConfig config = config(true, true, true);

        assertEquals(WorkflowStage.STRUCTURE_VALIDATION,
                router.route(WorkflowStage.ROADMAP_EDIT, designed(config), config).next());
    }

    @ParameterizedTest
    @CsvSource({
            "true,  false, CONTENT_GENERATION",
            "true,  true,  COMPLETED",
            "false, false, ROADMAP_EDIT",
            "false, true,  ROADMAP_EDIT"
    })
    void afterHumanReview(boolean approved, boolean skipContent, WorkflowStage expected) {
        WorkflowConfig config = config(false, false, skipContent);
        WorkflowState state = designed(config);
        state.apply(StateDelta.builder().humanApproved(approved).reviewFeedback(approved ? null : "too long").build());

        Transition t = router.route(WorkflowStage.HUMAN_REVIEW, state, config);

        assertEquals(expected, t.next());
        if (!approved) {
            assertEquals(EditSource.HUMAN_REVIEW, t.delta().getEditSource());
        }
    }

    @Test
    void contentOutcomeDecidesBetweenCompletedAndPartialFailure() {
        WorkflowConfig config = WorkflowConfig.defaults();
        WorkflowState clean = designed(config);
        WorkflowState partial = designed(config);
        partial.apply(StateDelta.builder()
                .failedConcepts(Map.of(Fixtures.conceptId(ROADMAP_ID, 1), EnumSet.of(ContentType.QUIZ)))
                .build());

        assertEquals(WorkflowStage.COMPLETED, router.route(WorkflowStage.CONTENT_GENERATION, clean, config).next());
        assertEquals(WorkflowStage.PARTIAL_FAILURE, router.route(WorkflowStage.CONTENT_GENERATION, partial, config).next());
    }

    @Test
    void unmappedPairIsAConfigurationError() {
        WorkflowConfig config = WorkflowConfig.defaults();
        WorkflowState state = Fixtures.state("run", config);

        WorkflowConfigurationException noRoadmap = assertThrows(WorkflowConfigurationException.class,
                () -> router.route(WorkflowStage.INTENT_ANALYSIS, state, config));
        assertTrue(noRoadmap.getMessage().contains("roadmapId missing"));

        assertThrows(WorkflowConfigurationException.class,
                () -> router.route(WorkflowStage.STRUCTURE_VALIDATION, state, config));
        assertThrows(WorkflowConfigurationException.class,
                () -> router.route(WorkflowStage.COMPLETED, state, config));
    }

    @Test
    void sameInputsGiveTheSameTransition() {
        WorkflowConfig config = config(true, false, false);
        WorkflowState state = designed(config);

        Transition first = router.route(WorkflowStage.CURRICULUM_DESIGN, state, config);
        Transition second = router.route(WorkflowStage.CURRICULUM_DESIGN, state, config);

        assertEquals(first.next(), second.next());
        assertEquals(first.outcome(), second.outcome());
    }
}
