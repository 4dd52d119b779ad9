package com.learnflow.learnflow_backend.repository;

import com.learnflow.learnflow_backend.model.domain.WorkflowCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CheckpointRepository extends JpaRepository<WorkflowCheckpoint, UUID> {

    // Head of the chain; resume always starts here
    Optional<WorkflowCheckpoint> findFirstByRunIdOrderBySequenceIdDesc(String runId);

    List<WorkflowCheckpoint> findByRunIdOrderBySequenceIdAsc(String runId);

    long countByRunId(String runId);
}
