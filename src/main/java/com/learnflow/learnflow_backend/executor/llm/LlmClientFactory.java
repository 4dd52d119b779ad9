package com.learnflow.learnflow_backend.executor.llm;

import com.learnflow.learnflow_backend.config.LearnflowProperties;
import com.learnflow.learnflow_backend.model.domain.LlmProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(LearnflowProperties properties) {
        Duration timeout = properties.getAgent().getRequestTimeout();
        register(new AnthropicLlmClient(timeout));
        register(new OpenAiCompatibleLlmClient(LlmProvider.OPENAI, "gpt-4o-mini", timeout));
        register(new OpenAiCompatibleLlmClient(LlmProvider.GROQ, "llama-3.3-70b-versatile", timeout));
        register(new OpenAiCompatibleLlmClient(LlmProvider.MISTRAL, "mistral-small-latest", timeout));
        register(new OpenAiCompatibleLlmClient(LlmProvider.CUSTOM, "", timeout));
    }

    private void register(LlmClient client) {
        clientMap.put(client.getProvider(), client);
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No LlmClient registered for provider: " + provider);
        }
        return client;
    }
}
