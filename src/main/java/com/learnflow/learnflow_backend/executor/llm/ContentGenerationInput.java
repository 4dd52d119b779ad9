package com.learnflow.learnflow_backend.executor.llm;

import com.learnflow.learnflow_backend.model.roadmap.ContentGenerationRequest;

import java.util.List;

/** What a content agent sees: the unit's request plus any search results gathered for it. */
public record ContentGenerationInput(ContentGenerationRequest request, List<SearchHit> searchResults) {
}
