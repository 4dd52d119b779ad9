package com.learnflow.learnflow_backend.executor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

final class ProviderErrors {

    private ProviderErrors() {}

    /** Pulls {@code error.message} out of a provider error body, else the first 200 chars. */
    static String extract(ObjectMapper mapper, String body) {
        if (body == null) {
            return "";
        }
        try {
            Map<?, ?> parsed = mapper.readValue(body, Map.class);
            Object error = parsed.get("error");
            if (error instanceof Map) {
                Object message = ((Map<?, ?>) error).get("message");
                if (message != null) {
                    return message.toString();
                }
            }
        } catch (JsonProcessingException e) {
            // not JSON; fall through to the raw body
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
