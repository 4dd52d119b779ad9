package com.learnflow.learnflow_backend.model.roadmap;

import java.util.Arrays;

public enum ContentType {
    TUTORIAL,
    RESOURCE,
    QUIZ;

    public String wireName() {
        return name().toLowerCase();
    }

    public static ContentType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown content type: " + value));
    }
}
