package com.learnflow.learnflow_backend.model.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressEventType {
    STAGE_STARTED("stage_started"),
    STAGE_COMPLETED("stage_completed"),
    HUMAN_REVIEW_REQUIRED("human_review_required"),
    UNIT_STARTED("unit_started"),
    UNIT_COMPLETED("unit_completed"),
    UNIT_FAILED("unit_failed"),
    BATCH_SAVED("batch_saved"),
    JOB_COMPLETED("job_completed"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    ProgressEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }
}
