package com.learnflow.learnflow_backend.executor.llm;

public record SearchHit(String title, String url, String snippet) {
}
