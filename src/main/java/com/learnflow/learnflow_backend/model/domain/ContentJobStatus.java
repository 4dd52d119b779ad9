package com.learnflow.learnflow_backend.model.domain;

public enum ContentJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    PARTIAL_FAILURE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }
}
