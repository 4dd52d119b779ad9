package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;

/**
 * Routing decision: the next stage plus whatever bookkeeping the edge carries
 * (retry counter, exhausted flag, edit source).
 */
public record Transition(WorkflowStage next, String outcome, StateDelta delta) {

    public static Transition to(WorkflowStage next, String outcome) {
        return new Transition(next, outcome, StateDelta.empty());
    }
}
