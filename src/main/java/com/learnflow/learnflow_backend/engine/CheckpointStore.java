package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-run chain of state snapshots. Sequence ids start at 0 and
 * grow by one; each new link points at the previous head.
 */
public interface CheckpointStore {

    Checkpoint append(String runId, WorkflowStage stage, WorkflowState state);

    Optional<Checkpoint> latest(String runId);

    List<Checkpoint> history(String runId);
}
