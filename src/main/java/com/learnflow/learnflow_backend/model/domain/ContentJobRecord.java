package com.learnflow.learnflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Written once at enqueue and once at completion. Live progress goes through
 * pub/sub events, never through this row.
 */
@Entity
@Table(name = "content_jobs", indexes = @Index(name = "idx_content_job_run", columnList = "run_id"))
@Data
public class ContentJobRecord {

    @Id
    @Column(name = "job_id", nullable = false, updatable = false)
    private String jobId;

    @Column(name = "run_id", nullable = false)
    private String runId;

    @Column(name = "broker_task_id")
    private String brokerTaskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContentJobStatus status = ContentJobStatus.QUEUED;

    @Column(name = "failed_concept_count")
    private int failedConceptCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "failed_units")
    private Map<String, List<String>> failedUnits;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_summary")
    private Map<String, Object> executionSummary;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;
}
