package com.learnflow.learnflow_backend.executor.llm;

import com.learnflow.learnflow_backend.model.domain.LlmProvider;
import com.learnflow.learnflow_backend.model.llm.LlmRequest;
import com.learnflow.learnflow_backend.model.llm.LlmResponse;

public interface LlmClient {

    LlmProvider getProvider();

    /** Never throws for provider-side failures; those come back as {@link LlmResponse#error}. */
    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    String getDefaultModel();
}
