package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.config.LearnflowProperties;
import com.learnflow.learnflow_backend.config.LearnflowProperties.DispatchMode;
import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.job.ContentGenerationJob;
import com.learnflow.learnflow_backend.job.ContentJobPayload;
import com.learnflow.learnflow_backend.job.JobControl;
import com.learnflow.learnflow_backend.job.JobDispatcher;
import com.learnflow.learnflow_backend.job.JobResult;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In broker mode, hands the run's content off to the worker pool and parks the
 * run until the job reports back. In inline mode, runs the job on this thread.
 */
@Slf4j
@Component
public class ContentGenerationExecutor implements StageExecutor {

    private final JobDispatcher dispatcher;
    private final ContentGenerationJob job;
    private final WorkflowStore store;
    private final TransientRetry retry;
    private final DispatchMode mode;

    public ContentGenerationExecutor(JobDispatcher dispatcher,
                                     ContentGenerationJob job,
                                     WorkflowStore store,
                                     TransientRetry retry,
                                     LearnflowProperties properties) {
        this.dispatcher = dispatcher;
        this.job = job;
        this.store = store;
        this.retry = retry;
        this.mode = properties.getContent().getDispatchMode();
    }

    @Override
    public WorkflowStage supportedStage() {
        return WorkflowStage.CONTENT_GENERATION;
    }

    @Override
    public StageResult execute(WorkflowState state) {
        if (mode == DispatchMode.INLINE) {
            return runInline(state);
        }
        String jobId = dispatcher.dispatch(state);
        log.info("[ENGINE] runId={} content job {} dispatched", state.getRunId(), jobId);
        return StageResult.suspend(AwaitReason.CONTENT_JOB, StateDelta.builder()
                .contentJobId(jobId)
                .historyEntry("content_generation: dispatched job " + jobId)
                .build());
    }

    private StageResult runInline(WorkflowState state) {
        ContentJobPayload payload = dispatcher.payloadFor(state).build();
        retry.run("record job " + payload.getJobId(), () -> store.recordJob(payload.getJobId(), state.getRunId(), null));

        JobResult result = job.run(payload, JobControl.unbounded());
        return StageResult.advance(StateDelta.builder()
                .contentRefs(result.getContentRefs())
                .failedConcepts(result.getFailedConcepts())
                .contentJobId(result.getJobId())
                .historyEntry("content_generation: job " + result.getJobId() + " "
                        + result.getStatus().name().toLowerCase())
                .build());
    }
}
