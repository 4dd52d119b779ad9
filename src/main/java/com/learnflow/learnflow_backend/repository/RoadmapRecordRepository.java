package com.learnflow.learnflow_backend.repository;

import com.learnflow.learnflow_backend.model.domain.RoadmapRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RoadmapRecordRepository extends JpaRepository<RoadmapRecord, String> {
}
