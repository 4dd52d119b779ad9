package com.learnflow.learnflow_backend.model.roadmap;

public record ValidationRequest(RoadmapFramework framework, LearningPreferences preferences, int round) {
}
