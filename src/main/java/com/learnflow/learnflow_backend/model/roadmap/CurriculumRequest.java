package com.learnflow.learnflow_backend.model.roadmap;

public record CurriculumRequest(IntentAnalysis intent, UserRequest userRequest, String roadmapId) {
}
