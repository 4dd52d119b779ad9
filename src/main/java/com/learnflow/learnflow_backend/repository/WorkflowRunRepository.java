package com.learnflow.learnflow_backend.repository;

import com.learnflow.learnflow_backend.model.domain.WorkflowRun;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowRunRepository extends JpaRepository<WorkflowRun, String> {

    List<WorkflowRun> findByUserIdOrderByCreatedAtDesc(String userId);

    List<WorkflowRun> findByStatus(RunStatus status);
}
