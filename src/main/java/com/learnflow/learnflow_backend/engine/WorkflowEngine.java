package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.job.JobResult;
import com.learnflow.learnflow_backend.model.domain.WorkflowRun;
import com.learnflow.learnflow_backend.model.event.ProgressEvent;
import com.learnflow.learnflow_backend.model.event.ProgressEventType;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.HumanDecision;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Interpreter loop over the workflow graph. One run advances one stage at a time:
 * route, execute, merge, checkpoint. Suspension persists the state and returns
 * immediately; every entry point reloads the latest checkpoint first, so calling
 * it twice for the same run continues rather than restarts.
 */
@Slf4j
@Service
public class WorkflowEngine {

    private final WorkflowGraph graph;
    private final CheckpointStore checkpoints;
    private final WorkflowStore store;
    private final StateManager stateManager;
    private final WorkflowErrorHandler errorHandler;
    private final NotificationPort notifications;
    private final TransientRetry retry;

    public WorkflowEngine(WorkflowGraph graph,
                          CheckpointStore checkpoints,
                          WorkflowStore store,
                          StateManager stateManager,
                          WorkflowErrorHandler errorHandler,
                          NotificationPort notifications,
                          TransientRetry retry) {
        this.graph = graph;
        this.checkpoints = checkpoints;
        this.store = store;
        this.stateManager = stateManager;
        this.errorHandler = errorHandler;
        this.notifications = notifications;
        this.retry = retry;
    }

    public WorkflowResult execute(WorkflowState initialState) {
        String runId = initialState.getRunId();
        Optional<Checkpoint> latest = loadLatest(runId);

        WorkflowState state;
        if (latest.isPresent()) {
            state = latest.get().state();
            log.info("[ENGINE] runId={} continuing from checkpoint seq={} stage={}",
                    runId, latest.get().sequenceId(), state.getCurrentStage().wireName());
            if (state.getCurrentStage().isTerminal()) {
                return finalResult(state);
            }
            if (state.awaitingInput()) {
                return suspendedResult(state);
            }
        } else {
            state = initialState;
            if (state.getConfig() == null) {
                state.setConfig(WorkflowConfig.defaults());
            }
            log.info("[ENGINE] runId={} traceId={} starting", runId, state.getTraceId());
            retry.run("create run " + runId, () -> store.createRun(initialState));
            checkpoint(state);
        }

        stateManager.start(runId, state.getCurrentStage());
        return drive(state);
    }

    public WorkflowResult resume(String runId, HumanDecision decision) {
        WorkflowState state = loadLatest(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId))
                .state();

        if (state.getCurrentStage().isTerminal()) {
            return finalResult(state);
        }
        if (state.getAwaiting() == AwaitReason.CONTENT_JOB) {
            return suspendedResult(state);
        }
        if (state.getAwaiting() == null) {
            // The decision was recorded by an earlier resume before the process went down
            log.info("[ENGINE] runId={} not parked (approved={}), continuing from stage={}",
                    runId, state.getHumanApproved(), state.getCurrentStage().wireName());
            stateManager.start(runId, state.getCurrentStage());
            return drive(state);
        }

        log.info("[ENGINE] runId={} resumed with decision approved={}", runId, decision.approved());
        state.apply(StateDelta.builder()
                .humanApproved(decision.approved())
                .reviewFeedback(decision.feedback())
                .clearAwaiting(true)
                .historyEntry("human_review: " + (decision.approved() ? "approved" : "rejected"))
                .build());
        checkpoint(state);
        retry.run("update status " + runId,
                () -> store.updateStatus(runId, RunStatus.PROCESSING, state.getCurrentStage().wireName(), null));
        stateManager.start(runId, state.getCurrentStage());
        return drive(state);
    }

    /**
     * Folds a finished content job into its run. Results of a retry job update a
     * run that already finished; any other result must match the job the run is
     * waiting for.
     */
    public WorkflowResult completeContentGeneration(String runId, JobResult result) {
        WorkflowState state = loadLatest(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId))
                .state();

        if (result.isRetry()) {
            return foldRetry(state, result);
        }
        if (state.getCurrentStage().isTerminal()) {
            return finalResult(state);
        }
        if (state.getAwaiting() == null) {
            // The dispatching stage has not written its suspension checkpoint yet
            throw new TransientInfraException("Run " + runId + " is not parked yet for job " + result.getJobId());
        }
        if (state.getAwaiting() != AwaitReason.CONTENT_JOB || !result.getJobId().equals(state.getContentJobId())) {
            if (state.getAwaiting() == AwaitReason.HUMAN_REVIEW) {
                log.warn("[ENGINE] runId={} ignoring result of job {}: run is waiting for review",
                        runId, result.getJobId());
                return suspendedResult(state);
            }
            throw new IllegalStateException("Run " + runId + " is not waiting for content job " + result.getJobId());
        }

        log.info("[ENGINE] runId={} content job {} reported status={} failedConcepts={}",
                runId, result.getJobId(), result.getStatus(), result.failedConceptCount());
        errorHandler.withErrorHandling(WorkflowStage.CONTENT_GENERATION.wireName(), runId, () ->
                state.apply(StateDelta.builder()
                        .contentRefs(result.getContentRefs())
                        .failedConcepts(result.getFailedConcepts())
                        .clearAwaiting(true)
                        .historyEntry("content_generation: job " + result.getJobId() + " " + result.getStatus().name().toLowerCase())
                        .build()));
        checkpoint(state);
        stateManager.start(runId, state.getCurrentStage());
        return drive(state);
    }

    /** Marks a run failed after its content job crashed outside any stage. */
    public void failRun(String runId, Throwable cause) {
        loadLatest(runId).map(Checkpoint::state).ifPresent(state -> {
            if (!state.getCurrentStage().isTerminal()) {
                markFailed(state, cause);
            }
        });
    }

    public List<Checkpoint> history(String runId) {
        return checkpoints.history(runId);
    }

    public Optional<WorkflowState> currentState(String runId) {
        return loadLatest(runId).map(Checkpoint::state);
    }

    private WorkflowResult drive(WorkflowState state) {
        String runId = state.getRunId();
        WorkflowConfig config = state.getConfig();
        int executions = 0;

        try {
            while (true) {
                WorkflowStage from = state.getCurrentStage();
                Transition transition = errorHandler.withErrorHandling(from.wireName(), runId, () -> {
                    Transition t = graph.route(from, state, config);
                    state.apply(t.delta());
                    return t;
                });
                WorkflowStage next = transition.next();

                if (next.isTerminal()) {
                    return finish(state, next, true);
                }
                if (++executions > graph.maxStageExecutions()) {
                    throw errorHandler.report(next.wireName(), runId, new WorkflowConfigurationException(
                            "Run " + runId + " exceeded " + graph.maxStageExecutions() + " stage executions"));
                }

                notifications.publish(runId, ProgressEvent.of(ProgressEventType.STAGE_STARTED, next.wireName(),
                        "Stage " + next.wireName() + " started"));
                stateManager.update(runId, next, RunStatus.PROCESSING);

                StageResult result = errorHandler.withErrorHandling(next.wireName(), runId, () -> {
                    StageResult r = graph.executorFor(next).execute(state);
                    StateDelta delta = r.delta() != null ? r.delta() : StateDelta.empty();
                    if (delta.getHistoryEntry() == null) {
                        delta.setHistoryEntry(next.wireName() + ": done");
                    }
                    state.apply(delta);
                    return r;
                });
                state.setCurrentStage(next);

                if (result.suspended()) {
                    return suspend(state, result.awaitReason());
                }
                checkpoint(state);
                notifications.publish(runId, ProgressEvent.of(ProgressEventType.STAGE_COMPLETED, next.wireName(),
                        "Stage " + next.wireName() + " completed"));
            }
        } catch (RuntimeException e) {
            markFailed(state, e);
            throw e;
        }
    }

    private WorkflowResult suspend(WorkflowState state, AwaitReason reason) {
        String runId = state.getRunId();
        state.apply(StateDelta.builder().awaiting(reason).build());
        checkpoint(state);

        RunStatus status = statusWhileAwaiting(reason);
        retry.run("update status " + runId,
                () -> store.updateStatus(runId, status, state.getCurrentStage().wireName(), null));
        // A parked run holds nothing in process; the run row answers status until it resumes
        stateManager.clear(runId);
        log.info("[ENGINE] runId={} suspended at {} awaiting {}", runId, state.getCurrentStage().wireName(), reason);
        return WorkflowResult.suspended(state, status);
    }

    private WorkflowResult finish(WorkflowState state, WorkflowStage terminal, boolean keepCancelled) {
        String runId = state.getRunId();
        state.setCurrentStage(terminal);
        state.apply(StateDelta.history(terminal.wireName()));
        checkpoint(state);

        RunStatus status = terminalStatus(state, keepCancelled);
        retry.run("archive run " + runId, () -> store.archive(state, status));
        stateManager.clear(runId);

        log.info("[ENGINE] runId={} finished stage={} status={} failedConcepts={}",
                runId, terminal.wireName(), status.wireName(), state.getFailedConcepts().size());
        notifications.publish(runId, ProgressEvent.of(ProgressEventType.COMPLETED, terminal.wireName(),
                        "Run finished with status " + status.wireName())
                .with("status", status.wireName())
                .with("roadmapId", state.getRoadmapId())
                .with("failedConcepts", state.hasFailures() ? state.failureSummary() : null));
        return WorkflowResult.finished(state, status);
    }

    private WorkflowResult foldRetry(WorkflowState state, JobResult result) {
        if (!state.getCurrentStage().isTerminal()) {
            throw new IllegalStateException("Retry results for run " + state.getRunId() + " which has not finished");
        }
        log.info("[ENGINE] runId={} folding retry job {} ({} units recovered, {} still failing)",
                state.getRunId(), result.getJobId(), result.getCompletedUnits(), result.getFailedUnits());
        state.recover(result.getContentRefs(), result.getFailedConcepts());
        state.apply(StateDelta.builder()
                .contentJobId(result.getJobId())
                .historyEntry("retry job " + result.getJobId() + " " + result.getStatus().name().toLowerCase())
                .build());
        WorkflowStage terminal = state.hasFailures() ? WorkflowStage.PARTIAL_FAILURE : WorkflowStage.COMPLETED;
        return finish(state, terminal, false);
    }

    private void markFailed(WorkflowState state, Throwable cause) {
        String runId = state.getRunId();
        try {
            state.setCurrentStage(WorkflowStage.FAILED);
            state.apply(StateDelta.history("failed: " + WorkflowErrorHandler.truncate(WorkflowErrorHandler.describe(cause))));
            checkpoints.append(runId, WorkflowStage.FAILED, state);
            store.archive(state, RunStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("[ENGINE] runId={} could not record failure: {}", runId, e.getMessage());
        } finally {
            stateManager.clear(runId);
        }
    }

    private WorkflowResult finalResult(WorkflowState state) {
        return WorkflowResult.finished(state, terminalStatus(state, true));
    }

    private WorkflowResult suspendedResult(WorkflowState state) {
        return WorkflowResult.suspended(state, statusWhileAwaiting(state.getAwaiting()));
    }

    private RunStatus terminalStatus(WorkflowState state, boolean keepCancelled) {
        RunStatus byStage = RunStatus.forTerminalStage(state.getCurrentStage());
        if (!keepCancelled || byStage == RunStatus.FAILED) {
            return byStage;
        }
        // A cancelled content job still routes to a terminal stage; the run keeps its cancelled status
        return store.getRun(state.getRunId())
                .map(WorkflowRun::getStatus)
                .filter(s -> s == RunStatus.CANCELLED)
                .orElse(byStage);
    }

    private static RunStatus statusWhileAwaiting(AwaitReason reason) {
        return reason == AwaitReason.CONTENT_JOB ? RunStatus.CONTENT_GENERATING : RunStatus.HUMAN_REVIEW_PENDING;
    }

    private Optional<Checkpoint> loadLatest(String runId) {
        return retry.call("load checkpoint " + runId, () -> checkpoints.latest(runId));
    }

    private void checkpoint(WorkflowState state) {
        retry.call("checkpoint " + state.getRunId(),
                () -> checkpoints.append(state.getRunId(), state.getCurrentStage(), state));
    }
}
