package com.learnflow.learnflow_backend.job;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-process broker for local runs and tests. Nothing survives a restart.
 */
@Slf4j
public class InMemoryJobBroker implements JobBroker {

    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private final Map<String, ContentJobPayload> payloads = new ConcurrentHashMap<>();
    private final Map<String, BrokerTaskStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public String enqueue(ContentJobPayload payload) {
        String handle = UUID.randomUUID().toString();
        payloads.put(handle, payload);
        statuses.put(handle, BrokerTaskStatus.PENDING);
        queue.offer(handle);
        log.debug("[BROKER] enqueued handle={} jobId={}", handle, payload.getJobId());
        return handle;
    }

    @Override
    public BrokerTaskStatus poll(String handle) {
        return statuses.getOrDefault(handle, BrokerTaskStatus.UNKNOWN);
    }

    @Override
    public void revoke(String handle) {
        statuses.computeIfPresent(handle, (h, current) -> current.isFinished() ? current : BrokerTaskStatus.REVOKED);
    }

    @Override
    public Optional<BrokerTask> take(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                String handle = queue.poll(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
                if (handle == null) {
                    return Optional.empty();
                }
                if (statuses.replace(handle, BrokerTaskStatus.PENDING, BrokerTaskStatus.STARTED)) {
                    return Optional.of(new BrokerTask(handle, payloads.get(handle)));
                }
                log.info("[BROKER] skipping handle={} status={}", handle, poll(handle));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void acknowledge(String handle, BrokerTaskStatus status) {
        statuses.computeIfPresent(handle, (h, current) -> current == BrokerTaskStatus.REVOKED ? current : status);
    }
}
