package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

import java.time.Instant;

/**
 * One decoded link of a run's checkpoint chain.
 */
public record Checkpoint(String runId,
                         long sequenceId,
                         Long parentSequenceId,
                         WorkflowStage stage,
                         WorkflowState state,
                         Instant createdAt) {
}
