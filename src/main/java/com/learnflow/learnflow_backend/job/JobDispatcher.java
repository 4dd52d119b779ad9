package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.model.domain.ContentJobRecord;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.UnitKey;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Request-side half of the content stage: detaches what a worker needs from
 * the run's state and puts it on the broker. The job record gets its first
 * write here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDispatcher {

    private final JobBroker broker;
    private final WorkflowStore store;
    private final TransientRetry retry;
    private final ContentJobSettings settings;

    /** Dispatches generation of every enabled content type for every concept. */
    public String dispatch(WorkflowState state) {
        return enqueue(payloadFor(state).build());
    }

    /** Dispatches a job limited to the run's recorded (concept, type) failures. */
    public String dispatchRetry(WorkflowState state) {
        List<UnitKey> units = failedUnits(state);
        if (units.isEmpty()) {
            throw new IllegalStateException("Run " + state.getRunId() + " has no failed content units to retry");
        }
        return enqueue(payloadFor(state).retryUnits(units).build());
    }

    public ContentJobPayload.ContentJobPayloadBuilder payloadFor(WorkflowState state) {
        if (state.getFramework() == null || state.getRoadmapId() == null) {
            throw new IllegalStateException("Run " + state.getRunId() + " has no roadmap to generate content for");
        }
        int concurrency = state.getConfig() != null && state.getConfig().getContentConcurrencyLimit() > 0
                ? state.getConfig().getContentConcurrencyLimit()
                : settings.concurrencyLimit();
        return ContentJobPayload.builder()
                .jobId(UUID.randomUUID().toString())
                .runId(state.getRunId())
                .roadmapId(state.getRoadmapId())
                .userId(state.getUserRequest() != null ? state.getUserRequest().getUserId() : null)
                .framework(state.getFramework())
                .preferences(state.getUserRequest() != null ? state.getUserRequest().getPreferences() : null)
                .contentTypes(new ArrayList<>(settings.enabledTypes()))
                .concurrencyLimit(concurrency);
    }

    public static List<UnitKey> failedUnits(WorkflowState state) {
        List<UnitKey> units = new ArrayList<>();
        state.getFailedConcepts().forEach((conceptId, types) -> {
            for (ContentType type : ContentType.values()) {
                if (types.contains(type)) {
                    units.add(new UnitKey(conceptId, type));
                }
            }
        });
        return units;
    }

    /** Best effort; returns false when the job is unknown or has no broker task. */
    public boolean revoke(String jobId) {
        Optional<String> handle = brokerHandle(jobId);
        if (handle.isEmpty()) {
            log.warn("[BROKER] revoke requested for unknown job {}", jobId);
            return false;
        }
        retry.run("revoke " + jobId, () -> broker.revoke(handle.get()));
        log.info("[BROKER] revoke sent for jobId={} handle={}", jobId, handle.get());
        return true;
    }

    public BrokerTaskStatus status(String jobId) {
        return brokerHandle(jobId)
                .map(handle -> retry.call("poll " + jobId, () -> broker.poll(handle)))
                .orElse(BrokerTaskStatus.UNKNOWN);
    }

    private String enqueue(ContentJobPayload payload) {
        String handle = retry.call("enqueue " + payload.getJobId(), () -> broker.enqueue(payload));
        retry.run("record job " + payload.getJobId(),
                () -> store.recordJob(payload.getJobId(), payload.getRunId(), handle));
        log.info("[BROKER] dispatched jobId={} runId={} handle={} retryUnits={}",
                payload.getJobId(), payload.getRunId(), handle, payload.getRetryUnits().size());
        return payload.getJobId();
    }

    private Optional<String> brokerHandle(String jobId) {
        return retry.call("load job " + jobId, () -> store.getJob(jobId))
                .map(ContentJobRecord::getBrokerTaskId);
    }
}
