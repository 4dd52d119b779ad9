package com.learnflow.learnflow_backend.model.roadmap;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Input for one content unit. {@code searchApiKey} is the credential the
 * allocator pre-assigned to this concept; null means use the fallback provider.
 * It never leaves the process inside a prompt.
 */
public record ContentGenerationRequest(String roadmapId,
                                       Concept concept,
                                       ContentType contentType,
                                       LearningPreferences preferences,
                                       @JsonIgnore String searchApiKey) {
}
