package com.learnflow.learnflow_backend.repository;

import com.learnflow.learnflow_backend.model.domain.GeneratedContent;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GeneratedContentRepository extends JpaRepository<GeneratedContent, UUID> {

    Optional<GeneratedContent> findByRoadmapIdAndConceptIdAndContentType(String roadmapId, String conceptId, ContentType contentType);

    // Used to skip already-stored units when a job is re-run
    List<GeneratedContent> findByRoadmapId(String roadmapId);
}
