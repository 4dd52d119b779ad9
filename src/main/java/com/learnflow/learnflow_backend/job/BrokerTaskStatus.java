package com.learnflow.learnflow_backend.job;

public enum BrokerTaskStatus {
    PENDING,
    STARTED,
    SUCCESS,
    FAILURE,
    REVOKED,
    UNKNOWN;

    public boolean isFinished() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }
}
