package com.learnflow.learnflow_backend.executor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

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
 * Web search backing the resource generator. Called with the credential the
 * key allocator assigned to the unit's concept; a failed search yields no hits
 * and the generator proceeds without them.
 */
@Slf4j
@Component
public class WebSearchClient {

    static final String ENDPOINT = "https://api.tavily.com/search";

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper = new ObjectMapper();

    public List<SearchHit> search(String query, String apiKey, int maxResults) {
        if (apiKey == null || apiKey.isBlank()) {
            return List.of();
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("api_key", apiKey);
            body.put("query", query);
            body.put("max_results", maxResults);
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(ENDPOINT))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.warn("[SEARCH] HTTP {} for query '{}'", httpResp.statusCode(), query);
                return List.of();
            }
            List<SearchHit> hits = new ArrayList<>();
            for (JsonNode result : mapper.readTree(httpResp.body()).path("results")) {
                hits.add(new SearchHit(result.path("title").asText(""), result.path("url").asText(""),
                        result.path("content").asText("")));
            }
            return hits;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (Exception e) {
            log.warn("[SEARCH] query '{}' failed: {}", query, e.getMessage());
            return List.of();
        }
    }
}
