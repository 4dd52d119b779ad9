package com.learnflow.learnflow_backend.model.roadmap;

public record ValidationIssue(String severity, String location, String message) {
}
