package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Assembles a {@link WorkflowGraph}. Every executable stage must have both an
 * executor and outgoing routes, otherwise building fails before any run starts.
 */
public class GraphBuilder {

    private final Map<WorkflowStage, StageExecutor> executors = new EnumMap<>(WorkflowStage.class);
    private WorkflowRouter router;
    private int maxStageExecutions = 200;

    public static GraphBuilder create() {
        return new GraphBuilder();
    }

    public GraphBuilder executor(StageExecutor executor) {
        StageExecutor previous = executors.put(executor.supportedStage(), executor);
        if (previous != null && previous != executor) {
            throw new WorkflowConfigurationException("Two executors registered for stage '"
                    + executor.supportedStage().wireName() + "'");
        }
        return this;
    }

    public GraphBuilder executors(Iterable<? extends StageExecutor> all) {
        all.forEach(this::executor);
        return this;
    }

    public GraphBuilder router(WorkflowRouter router) {
        this.router = router;
        return this;
    }

    public GraphBuilder maxStageExecutions(int max) {
        this.maxStageExecutions = max;
        return this;
    }

    public WorkflowGraph build() {
        if (router == null) {
            throw new WorkflowConfigurationException("Workflow graph has no router");
        }
        if (maxStageExecutions <= 0) {
            throw new WorkflowConfigurationException("maxStageExecutions must be positive");
        }
        for (WorkflowStage stage : WorkflowStage.values()) {
            if (stage.isExecutable() && !executors.containsKey(stage)) {
                throw new WorkflowConfigurationException("No executor for stage '" + stage.wireName() + "'");
            }
            if (!stage.isTerminal() && !router.hasRoutesFrom(stage)) {
                throw new WorkflowConfigurationException("No routes leave stage '" + stage.wireName() + "'");
            }
        }
        return new WorkflowGraph(executors, router, maxStageExecutions);
    }
}
