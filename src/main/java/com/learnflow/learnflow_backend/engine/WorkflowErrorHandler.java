package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.job.JobResult;
import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.domain.WorkflowRun;
import com.learnflow.learnflow_backend.model.event.ProgressEvent;
import com.learnflow.learnflow_backend.model.event.ProgressEventType;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Uniform failure path for stage bodies and worker-side jobs: log, publish a
 * failed event, persist the failed status, then rethrow the original exception.
 * Nothing happens on normal completion.
 */
@Slf4j
@Component
public class WorkflowErrorHandler {

    private final WorkflowStore store;
    private final NotificationPort notifications;

    public WorkflowErrorHandler(WorkflowStore store, NotificationPort notifications) {
        this.store = store;
        this.notifications = notifications;
    }

    public <T> T withErrorHandling(String stage, String runId, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            handle(stage, runId, null, e);
            throw e;
        }
    }

    public void withErrorHandling(String stage, String runId, Runnable body) {
        withErrorHandling(stage, runId, () -> {
            body.run();
            return null;
        });
    }

    public <T> T withJobErrorHandling(String stage, String runId, String jobId, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            handle(stage, runId, jobId, e);
            throw e;
        }
    }

    /** Runs the failure path for an error raised outside a wrapped body and hands it back for throwing. */
    public RuntimeException report(String stage, String runId, RuntimeException error) {
        handle(stage, runId, null, error);
        return error;
    }

    private void handle(String stage, String runId, String jobId, RuntimeException error) {
        String message = describe(error);
        log.error("[ERROR] stage={} runId={} jobId={} errorType={} message={}",
                stage, runId, jobId, error.getClass().getSimpleName(), message, error);

        notifications.publish(runId, ProgressEvent.of(ProgressEventType.FAILED, stage, message)
                .with("errorType", error.getClass().getSimpleName())
                .with("jobId", jobId));

        String stored = truncate(message);
        try {
            store.updateStatus(runId, RunStatus.FAILED, stage, stored);
        } catch (RuntimeException persistError) {
            log.error("[ERROR] Could not persist failed status for run {}: {}", runId, persistError.getMessage());
        }
        if (jobId != null) {
            try {
                store.completeJob(JobResult.builder()
                        .jobId(jobId)
                        .runId(runId)
                        .status(ContentJobStatus.FAILED)
                        .stopReason(stored)
                        .build());
            } catch (RuntimeException persistError) {
                log.error("[ERROR] Could not persist failed status for job {}: {}", jobId, persistError.getMessage());
            }
        }
    }

    static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    static String truncate(String message) {
        return message.length() > WorkflowRun.MAX_ERROR_LENGTH
                ? message.substring(0, WorkflowRun.MAX_ERROR_LENGTH)
                : message;
    }
}
