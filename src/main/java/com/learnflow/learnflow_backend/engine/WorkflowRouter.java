package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import com.learnflow.learnflow_backend.model.workflow.EditSource;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;

import static com.learnflow.learnflow_backend.model.workflow.WorkflowStage.*;

/**
 * Transition table of the roadmap workflow. Pure: the same (stage, state, config)
 * always yields the same transition, which is what makes re-routing after a
 * reload safe. A stage/outcome pair without a row is a wiring error.
 */
@Slf4j
@Component
public class WorkflowRouter {

    private record Rule(WorkflowStage stage,
                        String outcome,
                        Predicate<WorkflowState> when,
                        BiFunction<WorkflowState, WorkflowConfig, Transition> then) {}

    private final List<Rule> rules = List.of(
            new Rule(INIT, "start", s -> true,
                    (s, c) -> Transition.to(INTENT_ANALYSIS, "start")),

            new Rule(INTENT_ANALYSIS, "analysed", s -> s.getRoadmapId() != null,
                    (s, c) -> Transition.to(CURRICULUM_DESIGN, "analysed")),

            new Rule(CURRICULUM_DESIGN, "designed", s -> s.getFramework() != null,
                    (s, c) -> c.isSkipValidation()
                            ? afterValidation(c, "validation_skipped", StateDelta.empty())
                            : Transition.to(STRUCTURE_VALIDATION, "designed")),

            new Rule(STRUCTURE_VALIDATION, "valid", s -> validation(s, true),
                    (s, c) -> afterValidation(c, "valid", StateDelta.empty())),

            new Rule(STRUCTURE_VALIDATION, "invalid", s -> validation(s, false),
                    WorkflowRouter::afterFailedValidation),

            new Rule(ROADMAP_EDIT, "edited", s -> s.getFramework() != null,
                    (s, c) -> Transition.to(STRUCTURE_VALIDATION, "edited")),

            new Rule(HUMAN_REVIEW, "approved", s -> Boolean.TRUE.equals(s.getHumanApproved()),
                    (s, c) -> c.isSkipContentGeneration()
                            ? Transition.to(COMPLETED, "approved")
                            : Transition.to(CONTENT_GENERATION, "approved")),

            new Rule(HUMAN_REVIEW, "rejected", s -> Boolean.FALSE.equals(s.getHumanApproved()),
                    (s, c) -> new Transition(ROADMAP_EDIT, "rejected",
                            StateDelta.builder().editSource(EditSource.HUMAN_REVIEW).build())),

            new Rule(CONTENT_GENERATION, "all_generated", s -> !s.hasFailures(),
                    (s, c) -> Transition.to(COMPLETED, "all_generated")),

            new Rule(CONTENT_GENERATION, "some_failed", WorkflowState::hasFailures,
                    (s, c) -> Transition.to(PARTIAL_FAILURE, "some_failed"))
    );

    public Transition route(WorkflowStage stage, WorkflowState state, WorkflowConfig config) {
        for (Rule rule : rules) {
            if (rule.stage() == stage && rule.when().test(state)) {
                Transition transition = rule.then().apply(state, config);
                log.debug("[ROUTER] runId={} {} --{}--> {}",
                        state.getRunId(), stage.wireName(), transition.outcome(), transition.next().wireName());
                return transition;
            }
        }
        throw new WorkflowConfigurationException(
                "No route from stage '" + stage.wireName() + "' for run " + state.getRunId() + describeOutcome(stage, state));
    }

    /** Stages that have at least one outgoing row. */
    public boolean hasRoutesFrom(WorkflowStage stage) {
        return rules.stream().anyMatch(r -> r.stage() == stage);
    }

    private static Transition afterFailedValidation(WorkflowState state, WorkflowConfig config) {
        if (state.getValidationRetryCount() < config.getMaxValidationRetries()) {
            return new Transition(ROADMAP_EDIT, "invalid_retry", StateDelta.builder()
                    .validationRetryCount(state.getValidationRetryCount() + 1)
                    .editSource(EditSource.VALIDATION_FAILED)
                    .build());
        }
        return afterValidation(config, "invalid_exhausted",
                StateDelta.builder().validationExhausted(true).build());
    }

    // Where a roadmap goes once validation is over, honouring the skip flags
    private static Transition afterValidation(WorkflowConfig config, String outcome, StateDelta delta) {
        if (!config.isSkipHumanReview()) {
            return new Transition(HUMAN_REVIEW, outcome, delta);
        }
        if (!config.isSkipContentGeneration()) {
            return new Transition(CONTENT_GENERATION, outcome, delta);
        }
        return new Transition(COMPLETED, outcome, delta);
    }

    private static boolean validation(WorkflowState state, boolean expected) {
        ValidationResult result = state.getValidationResult();
        return result != null && result.isValid() == expected;
    }

    private static String describeOutcome(WorkflowStage stage, WorkflowState state) {
        return switch (stage) {
            case STRUCTURE_VALIDATION -> " (validationResult missing)";
            case HUMAN_REVIEW -> " (no review decision recorded)";
            case INTENT_ANALYSIS -> " (roadmapId missing)";
            case CURRICULUM_DESIGN, ROADMAP_EDIT -> " (framework missing)";
            default -> state.getCurrentStage().isTerminal() ? " (run already finished)" : "";
        };
    }
}
