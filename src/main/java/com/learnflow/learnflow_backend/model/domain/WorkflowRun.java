package com.learnflow.learnflow_backend.model.domain;

import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "workflow_runs")
@Data
public class WorkflowRun {

    public static final int MAX_ERROR_LENGTH = 500;

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Column(name = "trace_id")
    private String traceId;

    @Column(name = "user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.PROCESSING;

    @Column(name = "current_stage")
    private String currentStage;

    @Column(name = "roadmap_id")
    private String roadmapId;

    @Column(name = "content_job_id")
    private String contentJobId;

    @Column(name = "error_message", length = MAX_ERROR_LENGTH)
    private String errorMessage;

    // conceptId -> failed content types, kept for precise retry
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "failed_concepts")
    private Map<String, Object> failedConcepts;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_summary")
    private Map<String, Object> executionSummary;

    // Final state archived when the run reaches a terminal stage
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "state_snapshot")
    private Map<String, Object> stateSnapshot;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() { this.updatedAt = Instant.now(); }
}
