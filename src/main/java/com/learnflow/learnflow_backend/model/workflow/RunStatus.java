package com.learnflow.learnflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    PROCESSING("processing"),
    HUMAN_REVIEW_PENDING("human_review_pending"),
    CONTENT_GENERATING("content_generating"),
    COMPLETED("completed"),
    PARTIAL_FAILURE("partial_failure"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL_FAILURE || this == FAILED || this == CANCELLED;
    }

    public static RunStatus forTerminalStage(WorkflowStage stage) {
        return switch (stage) {
            case COMPLETED -> COMPLETED;
            case PARTIAL_FAILURE -> PARTIAL_FAILURE;
            case FAILED -> FAILED;
            default -> throw new IllegalArgumentException("Not a terminal stage: " + stage);
        };
    }
}
