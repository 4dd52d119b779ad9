package com.learnflow.learnflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "roadmaps")
@Data
public class RoadmapRecord {

    @Id
    @Column(name = "roadmap_id", nullable = false, updatable = false)
    private String roadmapId;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "run_id")
    private String runId;

    private String title;

    // Full framework tree including per-concept content status fields
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "framework_data")
    private Map<String, Object> frameworkData;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() { this.updatedAt = Instant.now(); }
}
