package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

/**
 * Either the run reached a terminal stage ({@code FINAL}) or it is parked
 * waiting for an external signal ({@code SUSPENDED}).
 */
public record WorkflowResult(Outcome outcome, RunStatus status, AwaitReason awaiting, WorkflowState state) {

    public enum Outcome { FINAL, SUSPENDED }

    public static WorkflowResult finished(WorkflowState state, RunStatus status) {
        return new WorkflowResult(Outcome.FINAL, status, null, state);
    }

    public static WorkflowResult suspended(WorkflowState state, RunStatus status) {
        return new WorkflowResult(Outcome.SUSPENDED, status, state.getAwaiting(), state);
    }

    public boolean isFinal() {
        return outcome == Outcome.FINAL;
    }

    public boolean isSuspended() {
        return outcome == Outcome.SUSPENDED;
    }

    public String runId() {
        return state.getRunId();
    }
}
