package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current stage of every run this process is actively driving. Entries are
 * inserted when a run starts or resumes and removed when it parks, is cancelled
 * or reaches a terminal stage; anything not here is answered from the run table.
 */
@Slf4j
@Component
public class StateManager {

    private final Map<String, LiveRun> liveRuns = new ConcurrentHashMap<>();

    public void start(String runId, WorkflowStage stage) {
        liveRuns.put(runId, new LiveRun(runId, stage, RunStatus.PROCESSING, Instant.now()));
    }

    public void update(String runId, WorkflowStage stage, RunStatus status) {
        liveRuns.put(runId, new LiveRun(runId, stage, status, Instant.now()));
    }

    public Optional<LiveRun> get(String runId) {
        return Optional.ofNullable(liveRuns.get(runId));
    }

    public void clear(String runId) {
        if (liveRuns.remove(runId) != null) {
            log.debug("[STATE] Cleared live entry for run {}", runId);
        }
    }

    public Collection<LiveRun> activeRuns() {
        return new ArrayList<>(liveRuns.values());
    }
}
