package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.config.LearnflowProperties;
import com.learnflow.learnflow_backend.engine.RetryConfig;
import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.engine.WorkflowEngine;
import com.learnflow.learnflow_backend.engine.WorkflowErrorHandler;
import com.learnflow.learnflow_backend.engine.WorkflowResult;
import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Consumer side of the broker. Takes tasks while it has free slots, runs each
 * job on the worker pool and folds the result back into its run. A watchdog
 * interrupts any job still running at the hard time limit.
 */
@Slf4j
public class ContentJobWorker {

    private final JobBroker broker;
    private final ContentGenerationJob job;
    private final WorkflowEngine engine;
    private final WorkflowErrorHandler errorHandler;
    private final ExecutorService jobExecutor;
    private final ScheduledExecutorService watchdog;
    private final Duration pollTimeout;
    private final Duration softLimit;
    private final Duration hardLimit;
    private final Semaphore slots;
    // The run may still be writing its suspension checkpoint when a short job finishes
    private final TransientRetry foldRetry = new TransientRetry(RetryConfig.of(8, 250L, 1.5d));

    public ContentJobWorker(JobBroker broker,
                            ContentGenerationJob job,
                            WorkflowEngine engine,
                            WorkflowErrorHandler errorHandler,
                            ExecutorService jobExecutor,
                            ScheduledExecutorService watchdog,
                            LearnflowProperties properties) {
        this.broker = broker;
        this.job = job;
        this.engine = engine;
        this.errorHandler = errorHandler;
        this.jobExecutor = jobExecutor;
        this.watchdog = watchdog;
        this.pollTimeout = properties.getBroker().getPollTimeout();
        this.softLimit = properties.getContent().getSoftTimeLimit();
        this.hardLimit = properties.getContent().getHardTimeLimit();
        this.slots = new Semaphore(Math.max(1, properties.getWorker().getPoolSize()));
    }

    /** Returns once the queue is empty or all slots are busy. */
    @Scheduled(fixedDelayString = "${learnflow.worker.poll-delay-ms:500}")
    public void pollOnce() {
        while (slots.tryAcquire()) {
            Optional<BrokerTask> task;
            try {
                task = broker.take(pollTimeout);
            } catch (RuntimeException e) {
                slots.release();
                log.warn("[BROKER] take failed, next poll retries: {}", e.getMessage());
                return;
            }
            if (task.isEmpty()) {
                slots.release();
                return;
            }
            start(task.get());
        }
    }

    public void shutdown() {
        watchdog.shutdownNow();
    }

    int freeSlots() {
        return slots.availablePermits();
    }

    private void start(BrokerTask task) {
        log.info("[CONTENT-JOB] worker picked jobId={} runId={} handle={}",
                task.payload().getJobId(), task.payload().getRunId(), task.handle());
        Future<?> running;
        try {
            running = jobExecutor.submit(() -> {
                try {
                    process(task);
                } finally {
                    slots.release();
                }
            });
        } catch (RuntimeException e) {
            slots.release();
            log.error("[CONTENT-JOB] could not start jobId={}: {}", task.payload().getJobId(), e.getMessage());
            acknowledge(task.handle(), BrokerTaskStatus.FAILURE);
            return;
        }
        watchdog.schedule(() -> {
            if (!running.isDone()) {
                log.error("[CONTENT-JOB] jobId={} hit the hard time limit of {} min, interrupting",
                        task.payload().getJobId(), hardLimit.toMinutes());
                running.cancel(true);
            }
        }, hardLimit.toMillis(), TimeUnit.MILLISECONDS);
    }

    void process(BrokerTask task) {
        ContentJobPayload payload = task.payload();
        String runId = payload.getRunId();
        String jobId = payload.getJobId();
        JobControl control = JobControl.of(() -> broker.isRevoked(task.handle()), softLimit, hardLimit);

        JobResult result;
        try {
            result = errorHandler.withJobErrorHandling(WorkflowStage.CONTENT_GENERATION.wireName(), runId, jobId,
                    () -> job.run(payload, control));
        } catch (RuntimeException e) {
            acknowledge(task.handle(), BrokerTaskStatus.FAILURE);
            engine.failRun(runId, e);
            return;
        }
        acknowledge(task.handle(), brokerStatusFor(result.getStatus()));

        try {
            WorkflowResult outcome = foldRetry.call("fold job " + jobId,
                    () -> engine.completeContentGeneration(runId, result));
            log.info("[CONTENT-JOB] jobId={} folded into runId={} -> {}", jobId, runId, outcome.status().wireName());
        } catch (RuntimeException e) {
            log.error("[CONTENT-JOB] jobId={} result could not be folded into runId={}: {}",
                    jobId, runId, e.getMessage());
        }
    }

    private void acknowledge(String handle, BrokerTaskStatus status) {
        try {
            broker.acknowledge(handle, status);
        } catch (RuntimeException e) {
            log.warn("[BROKER] acknowledge {} for handle={} failed: {}", status, handle, e.getMessage());
        }
    }

    static BrokerTaskStatus brokerStatusFor(ContentJobStatus status) {
        return switch (status) {
            case COMPLETED, PARTIAL_FAILURE -> BrokerTaskStatus.SUCCESS;
            case CANCELLED -> BrokerTaskStatus.REVOKED;
            default -> BrokerTaskStatus.FAILURE;
        };
    }
}
