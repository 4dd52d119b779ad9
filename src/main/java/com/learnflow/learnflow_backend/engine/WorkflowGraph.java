package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

import java.util.Map;

/**
 * Executors plus routing table, checked for completeness at build time.
 * Human review and (in broker mode) content generation are its suspend points.
 */
public class WorkflowGraph {

    private final Map<WorkflowStage, StageExecutor> executors;
    private final WorkflowRouter router;
    private final int maxStageExecutions;

    WorkflowGraph(Map<WorkflowStage, StageExecutor> executors, WorkflowRouter router, int maxStageExecutions) {
        this.executors = Map.copyOf(executors);
        this.router = router;
        this.maxStageExecutions = maxStageExecutions;
    }

    public StageExecutor executorFor(WorkflowStage stage) {
        StageExecutor executor = executors.get(stage);
        if (executor == null) {
            throw new WorkflowConfigurationException("No executor wired for stage '" + stage.wireName() + "'");
        }
        return executor;
    }

    public Transition route(WorkflowStage stage, WorkflowState state, WorkflowConfig config) {
        return router.route(stage, state, config);
    }

    public int maxStageExecutions() {
        return maxStageExecutions;
    }
}
