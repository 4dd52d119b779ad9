package com.learnflow.learnflow_backend.model.domain;

import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "generated_content",
       uniqueConstraints = @UniqueConstraint(name = "uk_content_unit",
               columnNames = {"roadmap_id", "concept_id", "content_type"}))
@Data
public class GeneratedContent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "roadmap_id", nullable = false)
    private String roadmapId;

    @Column(name = "concept_id", nullable = false)
    private String conceptId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false)
    private ContentType contentType;

    @Column(name = "result_ref", nullable = false, length = 1024)
    private String resultRef;

    @Column(columnDefinition = "text")
    private String content;

    @Column(name = "job_id")
    private String jobId;

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();
}
