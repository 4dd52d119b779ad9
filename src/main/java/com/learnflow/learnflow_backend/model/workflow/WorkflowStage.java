package com.learnflow.learnflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum WorkflowStage {
    INIT("init"),
    INTENT_ANALYSIS("intent_analysis"),
    CURRICULUM_DESIGN("curriculum_design"),
    STRUCTURE_VALIDATION("structure_validation"),
    ROADMAP_EDIT("roadmap_edit"),
    HUMAN_REVIEW("human_review"),
    CONTENT_GENERATION("content_generation"),
    COMPLETED("completed"),
    PARTIAL_FAILURE("partial_failure"),
    FAILED("failed");

    private final String wireName;

    WorkflowStage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL_FAILURE || this == FAILED;
    }

    /** Stages backed by a StageExecutor. */
    public boolean isExecutable() {
        return this != INIT && !isTerminal();
    }

    @JsonCreator
    public static WorkflowStage fromWireName(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(value) || s.name().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow stage: " + value));
    }
}
