package com.learnflow.learnflow_backend.support;

import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Stage executor driven by a lambda; the second argument is the 1-based call number.
 */
public class ScriptedExecutor implements StageExecutor {

    private final WorkflowStage stage;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile BiFunction<WorkflowState, Integer, StageResult> script;

    public ScriptedExecutor(WorkflowStage stage, BiFunction<WorkflowState, Integer, StageResult> script) {
        this.stage = stage;
        this.script = script;
    }

    public void script(BiFunction<WorkflowState, Integer, StageResult> script) {
        this.script = script;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public WorkflowStage supportedStage() {
        return stage;
    }

    @Override
    public StageResult execute(WorkflowState state) {
        return script.apply(state, calls.incrementAndGet());
    }
}
