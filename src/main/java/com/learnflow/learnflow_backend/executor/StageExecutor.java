package com.learnflow.learnflow_backend.executor;

import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

public interface StageExecutor {

    WorkflowStage supportedStage();

    // Reads the state, never mutates it; the engine merges the returned delta
    StageResult execute(WorkflowState state);
}
