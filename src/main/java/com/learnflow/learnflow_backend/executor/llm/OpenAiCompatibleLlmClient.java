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

/**
 * Chat-completions client shared by OpenAI and every provider that speaks the
 * same wire format (Groq, Mistral, self-hosted gateways).
 */
@Slf4j
public class OpenAiCompatibleLlmClient implements LlmClient {

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper = new ObjectMapper();

    private final LlmProvider provider;
    private final String defaultModel;
    private final Duration requestTimeout;

    public OpenAiCompatibleLlmClient(LlmProvider provider, String defaultModel, Duration requestTimeout) {
        this.provider = provider;
        this.defaultModel = defaultModel;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public LlmProvider getProvider() { return provider; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : provider.getDefaultEndpoint();
        if (url.isBlank()) {
            return LlmResponse.error(provider.getDisplayName() + " has no endpoint configured");
        }
        String model = (req.getModel() != null && !req.getModel().isBlank()) ? req.getModel() : defaultModel;
        try {
            List<Map<String, String>> messages = new ArrayList<>();
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
            }
            messages.add(Map.of("role", "user", "content", req.getUserPrompt()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", messages);
            body.put("max_tokens", req.getMaxTokens());
            body.put("temperature", req.getTemperature());
            if (req.isJsonOutput()) {
                body.put("response_format", Map.of("type", "json_object"));
            }
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[{}] HTTP {}", provider, httpResp.statusCode());
                return LlmResponse.error(provider.getDisplayName() + " API error " + httpResp.statusCode() + ": "
                        + ProviderErrors.extract(mapper, httpResp.body()));
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> resp = mapper.readValue(httpResp.body(), Map.class);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> choices = (List<Map<String, Object>>) resp.get("choices");
            if (choices == null || choices.isEmpty()) {
                return LlmResponse.error(provider.getDisplayName() + " returned no choices");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
            String text = (String) message.get("content");
            @SuppressWarnings("unchecked")
            Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
            int inputTokens = usage != null ? ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue() : 0;
            int outputTokens = usage != null ? ((Number) usage.getOrDefault("completion_tokens", 0)).intValue() : 0;
            return LlmResponse.ok(text, (String) resp.getOrDefault("model", model), inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(provider.getDisplayName() + " call interrupted");
        } catch (Exception e) {
            log.error("[{}] Exception calling API", provider, e);
            return LlmResponse.error(provider.getDisplayName() + " client exception: " + e.getMessage());
        }
    }
}
