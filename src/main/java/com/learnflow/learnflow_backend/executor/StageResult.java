package com.learnflow.learnflow_backend.executor;

import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;

/**
 * What a stage hands back to the engine: a delta to merge, and optionally a
 * reason to stop and wait for an external signal instead of routing on.
 */
public record StageResult(StateDelta delta, AwaitReason awaitReason) {

    public static StageResult advance(StateDelta delta) {
        return new StageResult(delta, null);
    }

    public static StageResult suspend(AwaitReason reason, StateDelta delta) {
        return new StageResult(delta, reason);
    }

    public boolean suspended() {
        return awaitReason != null;
    }
}
