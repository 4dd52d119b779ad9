package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;

import java.time.Instant;

public record LiveRun(String runId, WorkflowStage stage, RunStatus status, Instant updatedAt) {
}
