package com.learnflow.learnflow_backend.service;

import com.learnflow.learnflow_backend.config.LearnflowProperties;
import com.learnflow.learnflow_backend.config.LearnflowProperties.DispatchMode;
import com.learnflow.learnflow_backend.engine.LiveRun;
import com.learnflow.learnflow_backend.engine.StateManager;
import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.engine.WorkflowEngine;
import com.learnflow.learnflow_backend.engine.WorkflowResult;
import com.learnflow.learnflow_backend.job.ContentGenerationJob;
import com.learnflow.learnflow_backend.job.ContentJobPayload;
import com.learnflow.learnflow_backend.job.JobControl;
import com.learnflow.learnflow_backend.job.JobDispatcher;
import com.learnflow.learnflow_backend.job.JobResult;
import com.learnflow.learnflow_backend.model.domain.WorkflowRun;
import com.learnflow.learnflow_backend.model.roadmap.UserRequest;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.HumanDecision;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Entry points an API layer maps onto: start, resume, status, cancel and retry.
 */
@Slf4j
@Service
public class WorkflowService {

    private final WorkflowEngine engine;
    private final StateManager stateManager;
    private final WorkflowStore store;
    private final JobDispatcher dispatcher;
    private final ContentGenerationJob contentJob;
    private final TransientRetry retry;
    private final LearnflowProperties properties;

    public WorkflowService(WorkflowEngine engine,
                           StateManager stateManager,
                           WorkflowStore store,
                           JobDispatcher dispatcher,
                           ContentGenerationJob contentJob,
                           TransientRetry retry,
                           LearnflowProperties properties) {
        this.engine = engine;
        this.stateManager = stateManager;
        this.store = store;
        this.dispatcher = dispatcher;
        this.contentJob = contentJob;
        this.retry = retry;
        this.properties = properties;
    }

    /**
     * Starts a new run and drives it until it finishes or parks. The run's
     * config is fixed here from the current properties.
     */
    public WorkflowResult start(UserRequest request) {
        if (request == null || request.getPreferences() == null || request.getPreferences().getLearningGoal() == null) {
            throw new IllegalArgumentException("A learning goal is required to start a run");
        }
        String runId = UUID.randomUUID().toString();
        String traceId = UUID.randomUUID().toString();
        WorkflowState state = WorkflowState.initial(runId, traceId, request, properties.workflowConfig());
        log.info("[ENGINE] start runId={} traceId={} userId={}", runId, traceId, request.getUserId());
        return engine.execute(state);
    }

    public WorkflowResult resume(String runId, HumanDecision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("A review decision is required to resume run " + runId);
        }
        return engine.resume(runId, decision);
    }

    /** Live stage tracker first, stored run second. */
    public Optional<RunStatusView> status(String runId) {
        Optional<LiveRun> live = stateManager.get(runId);
        Optional<WorkflowRun> stored = retry.call("load run " + runId, () -> store.getRun(runId));
        if (live.isPresent()) {
            LiveRun run = live.get();
            return Optional.of(new RunStatusView(runId, run.status(), run.stage().wireName(),
                    stored.map(WorkflowRun::getRoadmapId).orElse(null),
                    stored.map(WorkflowRun::getContentJobId).orElse(null),
                    null, Map.of(), true, run.updatedAt()));
        }
        return stored.map(run -> new RunStatusView(runId, run.getStatus(), run.getCurrentStage(), run.getRoadmapId(),
                run.getContentJobId(), run.getErrorMessage(), failureSummary(run), false, run.getUpdatedAt()));
    }

    /**
     * Revokes the run's in-flight content job. Batches already stored stay; the
     * run ends as cancelled once the worker reports back.
     */
    public boolean cancelContentJob(String runId) {
        WorkflowState state = engine.currentState(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        if (state.getAwaiting() != AwaitReason.CONTENT_JOB || state.getContentJobId() == null) {
            throw new IllegalStateException("Run " + runId + " has no content job in flight");
        }
        retry.run("mark run cancelled " + runId, () -> store.updateStatus(runId, RunStatus.CANCELLED,
                state.getCurrentStage().wireName(), "content job cancelled by request"));
        stateManager.clear(runId);
        boolean revoked = dispatcher.revoke(state.getContentJobId());
        log.info("[ENGINE] runId={} cancel requested for job {} (revoked={})", runId, state.getContentJobId(), revoked);
        return revoked;
    }

    /**
     * Regenerates exactly the (concept, content type) units the run recorded as
     * failed. Returns the new job's id.
     */
    public String retryFailedUnits(String runId) {
        WorkflowState state = engine.currentState(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        if (state.getCurrentStage() != WorkflowStage.PARTIAL_FAILURE || !state.hasFailures()) {
            throw new IllegalStateException("Run " + runId + " has no failed content to retry (stage="
                    + state.getCurrentStage().wireName() + ")");
        }

        if (properties.getContent().getDispatchMode() == DispatchMode.BROKER) {
            String jobId = dispatcher.dispatchRetry(state);
            log.info("[ENGINE] runId={} retry job {} dispatched for {} units",
                    runId, jobId, JobDispatcher.failedUnits(state).size());
            return jobId;
        }

        ContentJobPayload payload = dispatcher.payloadFor(state)
                .retryUnits(JobDispatcher.failedUnits(state))
                .build();
        retry.run("record job " + payload.getJobId(), () -> store.recordJob(payload.getJobId(), runId, null));
        JobResult result = contentJob.run(payload, JobControl.unbounded());
        engine.completeContentGeneration(runId, result);
        return payload.getJobId();
    }

    private static Map<String, List<String>> failureSummary(WorkflowRun run) {
        Map<String, List<String>> summary = new TreeMap<>();
        if (run.getFailedConcepts() != null) {
            run.getFailedConcepts().forEach((conceptId, types) -> summary.put(conceptId,
                    types instanceof List ? ((List<?>) types).stream().map(String::valueOf).toList() : List.of()));
        }
        return summary;
    }
}
