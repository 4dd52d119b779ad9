package com.learnflow.learnflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON form of {@link WorkflowState} used in checkpoints and the archived run row.
 */
@Component
public class StateCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public StateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(WorkflowState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise state of run " + state.getRunId(), e);
        }
    }

    public WorkflowState decode(String json) {
        try {
            return objectMapper.readValue(json, WorkflowState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt checkpoint payload: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> toMap(WorkflowState state) {
        return objectMapper.convertValue(state, MAP_TYPE);
    }

    public WorkflowState copy(WorkflowState state) {
        return decode(encode(state));
    }
}
