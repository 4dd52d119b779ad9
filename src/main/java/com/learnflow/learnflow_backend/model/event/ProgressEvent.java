package com.learnflow.learnflow_backend.model.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEvent {

    private ProgressEventType type;
    private String stage;
    private String message;

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static ProgressEvent of(ProgressEventType type, String stage, String message) {
        return ProgressEvent.builder().type(type).stage(stage).message(message).build();
    }

    public ProgressEvent with(String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
        return this;
    }
}
