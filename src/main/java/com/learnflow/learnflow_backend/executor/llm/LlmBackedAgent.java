package com.learnflow.learnflow_backend.executor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnflow.learnflow_backend.config.LearnflowProperties;
import com.learnflow.learnflow_backend.executor.agent.Agent;
import com.learnflow.learnflow_backend.executor.agent.AgentException;
import com.learnflow.learnflow_backend.model.domain.LlmProvider;
import com.learnflow.learnflow_backend.model.domain.LlmProviderConfig;
import com.learnflow.learnflow_backend.model.llm.LlmRequest;
import com.learnflow.learnflow_backend.model.llm.LlmResponse;
import com.learnflow.learnflow_backend.repository.LlmProviderConfigRepository;
import lombok.extern.slf4j.Slf4j;

/**
 * Agent that serialises its input to JSON, sends it with a fixed system prompt
 * to the configured provider and maps the JSON reply onto {@code O}. A reply
 * that is not JSON gets one retry with a stricter instruction.
 */
@Slf4j
public class LlmBackedAgent<I, O> implements Agent<I, O> {

    private static final int MAX_INPUT_CHARS = 60_000;
    private static final String JSON_NUDGE = "\n\nIMPORTANT: Your response must be valid JSON only. No explanation text.";

    private final String name;
    private final String systemPrompt;
    private final Class<O> outputType;
    private final LlmClientFactory clientFactory;
    private final LlmProviderConfigRepository providerConfigRepo;
    private final ObjectMapper mapper;
    private final LearnflowProperties.Agent settings;

    public LlmBackedAgent(String name,
                          String systemPrompt,
                          Class<O> outputType,
                          LlmClientFactory clientFactory,
                          LlmProviderConfigRepository providerConfigRepo,
                          ObjectMapper mapper,
                          LearnflowProperties.Agent settings) {
        this.name = name;
        this.systemPrompt = systemPrompt;
        this.outputType = outputType;
        this.clientFactory = clientFactory;
        this.providerConfigRepo = providerConfigRepo;
        this.mapper = mapper;
        this.settings = settings;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public O execute(I input) {
        LlmProvider provider = settings.getProvider();
        LlmProviderConfig providerCfg = providerConfigRepo.findByProvider(provider)
                .filter(LlmProviderConfig::isEnabled)
                .orElseThrow(() -> new AgentException(name,
                        "No API key configured for provider '" + provider.getDisplayName() + "'"));

        String inputJson;
        try {
            inputJson = mapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new AgentException(name, "Failed to serialise input: " + e.getOriginalMessage(), e);
        }
        if (inputJson.length() > MAX_INPUT_CHARS) {
            throw new AgentException(name, "Input exceeds maximum size (" + MAX_INPUT_CHARS + " chars)");
        }

        String userPrompt = "INPUT:\n" + inputJson + "\n\nRespond with a valid JSON object only.";
        LlmRequest request = new LlmRequest(systemPrompt, userPrompt, modelFor(providerCfg));
        request.setMaxTokens(settings.getMaxTokens());
        request.setTemperature(settings.getTemperature());

        LlmClient client = clientFactory.getClient(provider);
        LlmResponse response = call(client, request, providerCfg);
        JsonNode parsed = extractJson(response.getRawText());
        if (parsed == null) {
            log.warn("[{}] First parse failed, retrying with JSON nudge", name);
            request.setUserPrompt(userPrompt + JSON_NUDGE);
            response = call(client, request, providerCfg);
            parsed = extractJson(response.getRawText());
        }
        if (parsed == null) {
            throw new AgentException(name, "Could not parse a JSON object from the model response. Raw: "
                    + truncate(response.getRawText(), 300));
        }

        log.info("[{}] completed. Tokens: {}in/{}out. Provider: {} model={}",
                name, response.getInputTokens(), response.getOutputTokens(), provider, response.getModel());
        try {
            return mapper.treeToValue(parsed, outputType);
        } catch (JsonProcessingException e) {
            throw new AgentException(name, "Reply does not match " + outputType.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    private LlmResponse call(LlmClient client, LlmRequest request, LlmProviderConfig providerCfg) {
        LlmResponse response = client.call(request, providerCfg.getApiKey(), providerCfg.getCustomEndpoint());
        if (!response.isSuccess()) {
            throw new AgentException(name, "LLM call failed: " + response.getErrorMessage());
        }
        return response;
    }

    private String modelFor(LlmProviderConfig providerCfg) {
        if (settings.getModel() != null && !settings.getModel().isBlank()) {
            return settings.getModel();
        }
        return providerCfg.getDefaultModel();
    }

    JsonNode extractJson(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String cleaned = raw.trim();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.replaceAll("^```[a-zA-Z]*\\n?", "").replaceAll("```$", "").trim();
        }
        int start = -1;
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (c == '{' || c == '[') { start = i; break; }
        }
        if (start == -1) return null;
        try {
            return mapper.readTree(cleaned.substring(start));
        } catch (JsonProcessingException e) {
            log.debug("[{}] JSON parse failed: {}", name, e.getOriginalMessage());
            return null;
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return "null";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
