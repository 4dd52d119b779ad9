package com.learnflow.learnflow_backend.executor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnflow.learnflow_backend.model.domain.LlmProvider;
import com.learnflow.learnflow_backend.model.llm.LlmRequest;
import com.learnflow.learnflow_backend.model.llm.LlmResponse;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class AnthropicLlmClient implements LlmClient {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final Duration requestTimeout;

    public AnthropicLlmClient(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultModel() { return "claude-haiku-4-5-20251001"; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : LlmProvider.ANTHROPIC.getDefaultEndpoint();
        String model = (req.getModel() != null && !req.getModel().isBlank()) ? req.getModel() : getDefaultModel();
        try {
            List<Map<String, String>> messages = new ArrayList<>();
            messages.add(Map.of("role", "user", "content", req.getUserPrompt()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("max_tokens", req.getMaxTokens());
            body.put("temperature", req.getTemperature());
            body.put("messages", messages);
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                body.put("system", req.getSystemPrompt());
            }
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[Anthropic] HTTP {}", httpResp.statusCode());
                return LlmResponse.error("Anthropic API error " + httpResp.statusCode() + ": "
                        + ProviderErrors.extract(mapper, httpResp.body()));
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> resp = mapper.readValue(httpResp.body(), Map.class);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> content = (List<Map<String, Object>>) resp.get("content");
            if (content == null || content.isEmpty()) {
                return LlmResponse.error("Anthropic returned no content blocks");
            }
            String text = (String) content.get(0).get("text");
            @SuppressWarnings("unchecked")
            Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
            int inputTokens = usage != null ? ((Number) usage.getOrDefault("input_tokens", 0)).intValue() : 0;
            int outputTokens = usage != null ? ((Number) usage.getOrDefault("output_tokens", 0)).intValue() : 0;
            return LlmResponse.ok(text, (String) resp.getOrDefault("model", model), inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error("Anthropic call interrupted");
        } catch (Exception e) {
            log.error("[Anthropic] Exception calling API", e);
            return LlmResponse.error("Anthropic client exception: " + e.getMessage());
        }
    }
}
