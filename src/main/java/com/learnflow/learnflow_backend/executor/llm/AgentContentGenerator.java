package com.learnflow.learnflow_backend.executor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.learnflow.learnflow_backend.executor.agent.Agent;
import com.learnflow.learnflow_backend.executor.agent.AgentException;
import com.learnflow.learnflow_backend.job.ContentGenerator;
import com.learnflow.learnflow_backend.model.roadmap.ContentGenerationRequest;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;

import java.util.List;

/**
 * Generates one content type through an agent. Resource units first search the
 * web with their allocated key; without a key they rely on the model alone.
 */
public class AgentContentGenerator implements ContentGenerator {

    private static final int SEARCH_RESULTS = 5;

    private final ContentType type;
    private final Agent<ContentGenerationInput, JsonNode> agent;
    private final WebSearchClient search;

    public AgentContentGenerator(ContentType type, Agent<ContentGenerationInput, JsonNode> agent, WebSearchClient search) {
        this.type = type;
        this.agent = agent;
        this.search = search;
    }

    @Override
    public ContentType supportedType() {
        return type;
    }

    @Override
    public String generate(ContentGenerationRequest request) {
        List<SearchHit> hits = type == ContentType.RESOURCE
                ? search.search(request.concept().getName() + " tutorial documentation",
                        request.searchApiKey(), SEARCH_RESULTS)
                : List.of();
        JsonNode body = agent.execute(new ContentGenerationInput(request, hits));
        if (body == null || body.isEmpty()) {
            throw new AgentException(agent.name(), "empty " + type.wireName() + " for concept "
                    + request.concept().getConceptId());
        }
        return body.toString();
    }
}
