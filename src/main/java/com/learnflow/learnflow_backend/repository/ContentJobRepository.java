package com.learnflow.learnflow_backend.repository;

import com.learnflow.learnflow_backend.model.domain.ContentJobRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ContentJobRepository extends JpaRepository<ContentJobRecord, String> {

    List<ContentJobRecord> findByRunIdOrderByCreatedAtDesc(String runId);
}
