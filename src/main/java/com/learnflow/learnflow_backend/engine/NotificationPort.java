package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.event.ProgressEvent;

/**
 * Fire-and-forget progress channel. Implementations must never throw;
 * a lost event is recoverable by polling run status.
 */
public interface NotificationPort {

    void publish(String runId, ProgressEvent event);
}
