package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.engine.NotificationPort;
import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.event.ProgressEvent;
import com.learnflow.learnflow_backend.model.event.ProgressEventType;
import com.learnflow.learnflow_backend.model.roadmap.Concept;
import com.learnflow.learnflow_backend.model.roadmap.ContentGenerationRequest;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.ContentUnit;
import com.learnflow.learnflow_backend.model.roadmap.ContentUnitStatus;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.UnitKey;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker-side fan-out over a roadmap's content units.
 *
 * <p>Units run under a semaphore, each on its pre-assigned credential; one
 * unit's failure never touches its siblings. Every {@code batchSize} finished
 * units the failure rate is checked and, at or above the threshold, no further
 * units are scheduled. Results are then stored in fixed-size batches per
 * content type, each in its own transaction, followed by one concept status
 * update and the single completion write of the job record.
 */
@Slf4j
public class ContentGenerationJob {

    private final KeyAllocator keyAllocator;
    private final ContentGeneratorRegistry generators;
    private final WorkflowStore store;
    private final NotificationPort notifications;
    private final TransientRetry retry;
    private final ContentJobSettings settings;

    public ContentGenerationJob(KeyAllocator keyAllocator,
                                ContentGeneratorRegistry generators,
                                WorkflowStore store,
                                NotificationPort notifications,
                                TransientRetry retry,
                                ContentJobSettings settings) {
        this.keyAllocator = keyAllocator;
        this.generators = generators;
        this.store = store;
        this.notifications = notifications;
        this.retry = retry;
        this.settings = settings;
    }

    public JobResult run(ContentJobPayload payload, JobControl control) {
        long startedAt = System.currentTimeMillis();
        String jobId = payload.getJobId();
        String runId = payload.getRunId();
        String roadmapId = payload.getRoadmapId();

        List<ContentUnit> units = flatten(payload);
        Map<UnitKey, String> stored = retry.call("load stored units " + roadmapId,
                () -> store.findCompletedUnits(roadmapId));

        Set<UnitKey> skipped = new HashSet<>();
        List<ContentUnit> pending = new ArrayList<>();
        for (ContentUnit unit : units) {
            String ref = stored.get(unit.key());
            if (ref != null) {
                unit.markCompleted(ref, null);
                skipped.add(unit.key());
            } else {
                pending.add(unit);
            }
        }

        KeyAllocation allocation = keyAllocator.allocate(
                pending.stream().map(ContentUnit::getConceptId).toList(), settings.minQuota());

        log.info("[CONTENT-JOB] jobId={} runId={} units={} skipped={} pending={} retry={}",
                jobId, runId, units.size(), skipped.size(), pending.size(), payload.retryJob());

        FanOut fanOut = new FanOut(payload, allocation, pending.size(), concurrencyFor(payload));
        Optional<StopReason> stop = fanOut.runAll(pending, control);

        int persistedBatches = 0;
        if (stop.isEmpty() || stop.get() == StopReason.SOFT_TIME_LIMIT) {
            Persisted persisted = persist(payload, units, skipped, control);
            persistedBatches = persisted.batches();
            if (persisted.stop().isPresent()) {
                stop = persisted.stop();
            }
        } else {
            String reason = "not stored: " + stop.get().description();
            units.stream().filter(u -> !skipped.contains(u.key())).forEach(u -> u.markUnsaved(reason));
        }

        boolean wrapUp = stop.isEmpty() || stop.get() == StopReason.SOFT_TIME_LIMIT;
        if (wrapUp) {
            List<ContentUnit> touched = units.stream().filter(u -> !skipped.contains(u.key())).toList();
            try {
                retry.run("update concept statuses " + roadmapId, () -> store.updateFrameworkStatuses(roadmapId, touched));
            } catch (RuntimeException e) {
                log.error("[CONTENT-JOB] jobId={} concept status update failed: {}", jobId, e.getMessage());
            }
        }

        JobResult result = summarise(payload, units, skipped, allocation, fanOut, stop, persistedBatches, startedAt);
        retry.run("complete job " + jobId, () -> store.completeJob(result));

        log.info("[CONTENT-JOB] jobId={} finished status={} completed={} failed={} skipped={} batches={} in {} ms",
                jobId, result.getStatus(), result.getCompletedUnits(), result.getFailedUnits(),
                result.getSkippedUnits(), result.getPersistedBatches(), result.getDurationMs());
        notifications.publish(runId, ProgressEvent.of(ProgressEventType.JOB_COMPLETED, "content_generation",
                        "Content job finished with status " + result.getStatus().name().toLowerCase())
                .with("jobId", jobId)
                .with("summary", result.executionSummary())
                .with("failedConcepts", result.failureSummary()));
        return result;
    }

    private int concurrencyFor(ContentJobPayload payload) {
        return payload.getConcurrencyLimit() > 0 ? payload.getConcurrencyLimit() : settings.concurrencyLimit();
    }

    private List<ContentUnit> flatten(ContentJobPayload payload) {
        RoadmapFramework framework = payload.getFramework();
        List<ContentUnit> units = new ArrayList<>();
        if (payload.retryJob()) {
            for (UnitKey key : payload.getRetryUnits()) {
                if (framework.containsConcept(key.conceptId())) {
                    units.add(new ContentUnit(key.conceptId(), key.contentType()));
                } else {
                    log.warn("[CONTENT-JOB] jobId={} retry unit {} not in framework, dropped", payload.getJobId(), key);
                }
            }
            return units;
        }
        List<ContentType> types = payload.getContentTypes() == null || payload.getContentTypes().isEmpty()
                ? settings.enabledTypes()
                : payload.getContentTypes();
        for (Concept concept : framework.allConcepts()) {
            for (ContentType type : types) {
                units.add(new ContentUnit(concept.getConceptId(), type));
            }
        }
        return units;
    }

    private record Persisted(int batches, Optional<StopReason> stop) {}

    /**
     * Stores newly generated units, batch by batch. A stop signal between two
     * batches leaves every later batch unsent.
     */
    private Persisted persist(ContentJobPayload payload, List<ContentUnit> units,
                                         Set<UnitKey> skipped, JobControl control) {
        String jobId = payload.getJobId();
        String roadmapId = payload.getRoadmapId();
        int batchNo = 0;

        List<List<ContentUnit>> batches = new ArrayList<>();
        for (ContentType type : ContentType.values()) {
            List<ContentUnit> ofType = units.stream()
                    .filter(u -> u.getContentType() == type)
                    .filter(u -> u.getStatus() == ContentUnitStatus.COMPLETED)
                    .filter(u -> !skipped.contains(u.key()))
                    .toList();
            for (int from = 0; from < ofType.size(); from += settings.batchSize()) {
                batches.add(ofType.subList(from, Math.min(from + settings.batchSize(), ofType.size())));
            }
        }

        for (int i = 0; i < batches.size(); i++) {
            Optional<StopReason> stop = control.stopReason()
                    .filter(r -> r != StopReason.SOFT_TIME_LIMIT);
            if (stop.isPresent()) {
                String reason = "not stored: " + stop.get().description();
                batches.subList(i, batches.size()).forEach(b -> b.forEach(u -> u.markUnsaved(reason)));
                log.warn("[CONTENT-JOB] jobId={} stopped before batch {}/{}: {}",
                        jobId, i + 1, batches.size(), stop.get().description());
                return new Persisted(batchNo, stop);
            }
            List<ContentUnit> batch = batches.get(i);
            ContentType type = batch.get(0).getContentType();
            try {
                retry.run("save batch " + jobId + "#" + (i + 1), () -> store.saveContentBatch(roadmapId, jobId, batch));
                batchNo++;
                notifications.publish(payload.getRunId(), ProgressEvent.of(ProgressEventType.BATCH_SAVED,
                                "content_generation", "Saved " + batch.size() + " " + type.wireName() + " units")
                        .with("jobId", jobId)
                        .with("batch", i + 1)
                        .with("contentType", type.wireName()));
            } catch (RuntimeException e) {
                // Earlier batches are committed and stay; this one's units become failures
                log.error("[CONTENT-JOB] jobId={} batch {}/{} ({}) failed to save: {}",
                        jobId, i + 1, batches.size(), type.wireName(), e.getMessage());
                batch.forEach(u -> u.markUnsaved("storage failed: " + e.getMessage()));
            }
        }
        log.debug("[CONTENT-JOB] jobId={} stored {} of {} batches", jobId, batchNo, batches.size());
        return new Persisted(batchNo, Optional.empty());
    }

    private JobResult summarise(ContentJobPayload payload, List<ContentUnit> units, Set<UnitKey> skipped,
                                KeyAllocation allocation, FanOut fanOut, Optional<StopReason> stop,
                                int persistedBatches, long startedAt) {
        Map<String, Map<ContentType, String>> refs = new TreeMap<>();
        Map<String, Set<ContentType>> failed = new TreeMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        int completed = 0;
        for (ContentUnit unit : units) {
            if (unit.getStatus() == ContentUnitStatus.COMPLETED) {
                refs.computeIfAbsent(unit.getConceptId(), k -> new TreeMap<>()).put(unit.getContentType(), unit.getResultRef());
                completed++;
            } else {
                failed.computeIfAbsent(unit.getConceptId(), k -> EnumSet.noneOf(ContentType.class)).add(unit.getContentType());
                errors.put(unit.key().toString(), unit.getError() != null ? unit.getError() : "not generated");
            }
        }
        int failedCount = units.size() - completed;
        int attempted = units.size() - skipped.size();
        long failedAttempted = units.stream()
                .filter(u -> !skipped.contains(u.key()))
                .filter(u -> u.getStatus() != ContentUnitStatus.COMPLETED)
                .count();
        boolean majorityFailed = attempted > 0 && (double) failedAttempted / attempted >= settings.failureThreshold();

        ContentJobStatus status;
        if (stop.isPresent() && stop.get() == StopReason.CANCELLED) {
            status = ContentJobStatus.CANCELLED;
        } else if (stop.isPresent() && stop.get() == StopReason.HARD_TIME_LIMIT) {
            status = ContentJobStatus.FAILED;
        } else if (fanOut.aborted || majorityFailed) {
            status = ContentJobStatus.FAILED;
        } else {
            status = failed.isEmpty() ? ContentJobStatus.COMPLETED : ContentJobStatus.PARTIAL_FAILURE;
        }

        return JobResult.builder()
                .jobId(payload.getJobId())
                .runId(payload.getRunId())
                .roadmapId(payload.getRoadmapId())
                .status(status)
                .retry(payload.retryJob())
                .contentRefs(refs)
                .failedConcepts(failed)
                .unitErrors(errors)
                .totalUnits(units.size())
                .completedUnits(completed)
                .failedUnits(failedCount)
                .skippedUnits(skipped.size())
                .persistedBatches(persistedBatches)
                .aborted(fanOut.aborted)
                .stopReason(stop.map(StopReason::description).orElse(fanOut.aborted ? "majority failure" : null))
                .durationMs(System.currentTimeMillis() - startedAt)
                .allocationStats(allocation.stats())
                .build();
    }

    static String contentRef(String roadmapId, UnitKey key) {
        return roadmapId + "/" + key.conceptId() + "/" + key.contentType().wireName();
    }

    /**
     * Scheduling state of one job's generation phase.
     */
    private final class FanOut {

        private final ContentJobPayload payload;
        private final KeyAllocation allocation;
        private final int limit;
        private final Semaphore permits;
        private final AtomicInteger finished = new AtomicInteger();
        private final AtomicInteger failures = new AtomicInteger();
        private volatile boolean aborted;
        private Optional<StopReason> stop = Optional.empty();

        FanOut(ContentJobPayload payload, KeyAllocation allocation, int unitCount, int limit) {
            this.payload = payload;
            this.allocation = allocation;
            this.limit = Math.max(1, Math.min(limit, Math.max(1, unitCount)));
            this.permits = new Semaphore(this.limit);
        }

        Optional<StopReason> runAll(List<ContentUnit> pending, JobControl control) {
            if (pending.isEmpty()) {
                return Optional.empty();
            }
            String jobId = payload.getJobId();
            ExecutorService pool = Executors.newFixedThreadPool(limit, threadFactory("content-unit-", jobId));
            // Generator calls run apart from the slot threads so a call that ignores
            // interruption after its timeout never holds a slot
            ExecutorService calls = Executors.newCachedThreadPool(threadFactory("content-call-", jobId));
            int scheduled = 0;
            try {
                for (ContentUnit unit : pending) {
                    if (scheduled > 0 && scheduled % settings.batchSize() == 0) {
                        stop = control.stopReason();
                        if (stop.isPresent()) {
                            log.warn("[CONTENT-JOB] jobId={} stops scheduling after {} units: {}",
                                    jobId, scheduled, stop.get().description());
                            break;
                        }
                    }
                    permits.acquire();
                    if (aborted) {
                        permits.release();
                        log.warn("[CONTENT-JOB] jobId={} failure rate {}/{} reached threshold {}, {} units left unscheduled",
                                jobId, failures.get(), finished.get(), settings.failureThreshold(), pending.size() - scheduled);
                        break;
                    }
                    submit(unit, pool, calls);
                    scheduled++;
                }
                // Every permit back means every scheduled unit has recorded its outcome
                permits.acquire(limit);
                permits.release(limit);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stop = Optional.of(StopReason.HARD_TIME_LIMIT);
                log.error("[CONTENT-JOB] jobId={} interrupted after scheduling {} units", jobId, scheduled);
            } finally {
                pool.shutdownNow();
                calls.shutdownNow();
            }

            String reason = aborted ? "aborted" : stop.map(StopReason::description).orElse("aborted");
            for (ContentUnit unit : pending) {
                if (!unit.finished() && unit.markFailed(reason)) {
                    failures.incrementAndGet();
                }
            }
            return stop;
        }

        private void submit(ContentUnit unit, ExecutorService pool, ExecutorService calls) {
            unit.markGenerating();
            String runId = payload.getRunId();
            String key = allocation.keyFor(unit.getConceptId());
            Concept concept = payload.getFramework().findConcept(unit.getConceptId()).orElseThrow();
            ContentGenerationRequest request = new ContentGenerationRequest(
                    payload.getRoadmapId(), concept, unit.getContentType(), payload.getPreferences(), key);

            notifications.publish(runId, ProgressEvent.of(ProgressEventType.UNIT_STARTED, "content_generation",
                            "Generating " + unit.key())
                    .with("conceptId", unit.getConceptId())
                    .with("contentType", unit.getContentType().wireName()));

            pool.execute(() -> {
                String body = null;
                Throwable error = null;
                // The unit's clock starts here, once a slot thread has picked it up
                Future<String> call = calls.submit(() -> generators.get(unit.getContentType()).generate(request));
                try {
                    body = call.get(settings.unitTimeout().toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    call.cancel(true);
                    error = e;
                } catch (ExecutionException e) {
                    error = e.getCause() != null ? e.getCause() : e;
                } catch (InterruptedException e) {
                    // Left unfinished; the job's stop reason is recorded for it
                    call.cancel(true);
                    Thread.currentThread().interrupt();
                    permits.release();
                    return;
                }
                try {
                    record(unit, body, error);
                } finally {
                    permits.release();
                }
            });
        }

        private void record(ContentUnit unit, String body, Throwable error) {
            String runId = payload.getRunId();
            if (error == null && body != null && !body.isBlank()) {
                if (unit.markCompleted(contentRef(payload.getRoadmapId(), unit.key()), body)) {
                    notifications.publish(runId, ProgressEvent.of(ProgressEventType.UNIT_COMPLETED, "content_generation",
                                    "Generated " + unit.key())
                            .with("conceptId", unit.getConceptId())
                            .with("contentType", unit.getContentType().wireName()));
                }
            } else {
                String reason = error == null ? "empty content"
                        : error instanceof TimeoutException ? "timed out after " + settings.unitTimeout().toMillis() + "ms"
                        : error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
                if (unit.markFailed(reason)) {
                    failures.incrementAndGet();
                    log.warn("[CONTENT-JOB] jobId={} unit {} failed: {}", payload.getJobId(), unit.key(), reason);
                    notifications.publish(runId, ProgressEvent.of(ProgressEventType.UNIT_FAILED, "content_generation",
                                    "Failed " + unit.key())
                            .with("conceptId", unit.getConceptId())
                            .with("contentType", unit.getContentType().wireName())
                            .with("error", reason));
                }
            }

            int done = finished.incrementAndGet();
            if (done % settings.batchSize() == 0
                    && (double) failures.get() / done >= settings.failureThreshold()) {
                aborted = true;
            }
        }

        private ThreadFactory threadFactory(String kind, String jobId) {
            AtomicInteger counter = new AtomicInteger();
            String prefix = kind + (jobId.length() > 8 ? jobId.substring(0, 8) : jobId) + "-";
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
