package com.learnflow.learnflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * One link of a run's append-only checkpoint chain. Rows are never updated.
 */
@Entity
@Immutable
@Table(name = "workflow_checkpoints",
       uniqueConstraints = @UniqueConstraint(name = "uk_checkpoint_run_sequence", columnNames = {"run_id", "sequence_id"}),
       indexes = @Index(name = "idx_checkpoint_run", columnList = "run_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Column(name = "sequence_id", nullable = false, updatable = false)
    private long sequenceId;

    @Column(name = "parent_sequence_id", updatable = false)
    private Long parentSequenceId;

    @Column(nullable = false, updatable = false)
    private String stage;

    @Column(name = "serialized_state", nullable = false, updatable = false, columnDefinition = "text")
    private String serializedState;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public WorkflowCheckpoint(String runId, long sequenceId, Long parentSequenceId, String stage, String serializedState) {
        this.runId = runId;
        this.sequenceId = sequenceId;
        this.parentSequenceId = parentSequenceId;
        this.stage = stage;
        this.serializedState = serializedState;
        this.createdAt = Instant.now();
    }
}
