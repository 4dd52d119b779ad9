package com.learnflow.learnflow_backend.job;

public enum StopReason {
    CANCELLED("cancelled"),
    SOFT_TIME_LIMIT("soft time limit reached"),
    HARD_TIME_LIMIT("hard time limit exceeded");

    private final String description;

    StopReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
