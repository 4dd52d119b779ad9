package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.executor.agent.Agent;
import com.learnflow.learnflow_backend.executor.agent.AgentException;
import com.learnflow.learnflow_backend.model.roadmap.LearningPreferences;
import com.learnflow.learnflow_backend.model.roadmap.ValidationRequest;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class StructureValidationExecutor implements StageExecutor {

    private final Agent<ValidationRequest, ValidationResult> structureValidator;

    public StructureValidationExecutor(Agent<ValidationRequest, ValidationResult> structureValidator) {
        this.structureValidator = structureValidator;
    }

    @Override
    public WorkflowStage supportedStage() {
        return WorkflowStage.STRUCTURE_VALIDATION;
    }

    @Override
    public StageResult execute(WorkflowState state) {
        int round = state.getValidationRetryCount() + 1;
        LearningPreferences preferences = state.getUserRequest() != null ? state.getUserRequest().getPreferences() : null;

        ValidationResult result = structureValidator.execute(
                new ValidationRequest(state.getFramework(), preferences, round));
        if (result == null) {
            throw new AgentException(structureValidator.name(), "no validation result");
        }

        log.info("[ENGINE] runId={} validation round {} valid={} issues={} score={}",
                state.getRunId(), round, result.isValid(), result.getIssues().size(), result.getOverallScore());
        return StageResult.advance(StateDelta.builder()
                .validationResult(result)
                .historyEntry("structure_validation: round " + round + (result.isValid() ? " passed" : " failed with "
                        + result.getIssues().size() + " issues"))
                .build());
    }
}
