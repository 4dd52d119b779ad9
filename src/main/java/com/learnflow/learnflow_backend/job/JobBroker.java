package com.learnflow.learnflow_backend.job;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable queue between the request side and the worker pool.
 */
public interface JobBroker {

    /** Enqueues the payload and returns the broker handle. */
    String enqueue(ContentJobPayload payload);

    BrokerTaskStatus poll(String handle);

    /** Best effort: a running task notices at its next batch boundary. */
    void revoke(String handle);

    default boolean isRevoked(String handle) {
        return poll(handle) == BrokerTaskStatus.REVOKED;
    }

    /**
     * Worker side. Blocks up to {@code timeout} for the next task and marks it
     * started; revoked tasks are skipped.
     */
    Optional<BrokerTask> take(Duration timeout);

    /** Worker side. Final status; a revoked task stays revoked. */
    void acknowledge(String handle, BrokerTaskStatus status);
}
