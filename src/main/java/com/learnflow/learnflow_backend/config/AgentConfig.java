package com.learnflow.learnflow_backend.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnflow.learnflow_backend.executor.agent.Agent;
import com.learnflow.learnflow_backend.executor.llm.AgentContentGenerator;
import com.learnflow.learnflow_backend.executor.llm.AgentPrompts;
import com.learnflow.learnflow_backend.executor.llm.ContentGenerationInput;
import com.learnflow.learnflow_backend.executor.llm.LlmBackedAgent;
import com.learnflow.learnflow_backend.executor.llm.LlmClientFactory;
import com.learnflow.learnflow_backend.executor.llm.WebSearchClient;
import com.learnflow.learnflow_backend.job.ContentGenerator;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.CurriculumRequest;
import com.learnflow.learnflow_backend.model.roadmap.EditRequest;
import com.learnflow.learnflow_backend.model.roadmap.IntentAnalysis;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.UserRequest;
import com.learnflow.learnflow_backend.model.roadmap.ValidationRequest;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import com.learnflow.learnflow_backend.repository.LlmProviderConfigRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The four roadmap agents and the three content generators, all LLM-backed.
 * Beans are told apart by their generic types.
 */
@Configuration
public class AgentConfig {

    private final LlmClientFactory clientFactory;
    private final LlmProviderConfigRepository providerConfigRepo;
    private final ObjectMapper objectMapper;
    private final LearnflowProperties properties;

    public AgentConfig(LlmClientFactory clientFactory,
                       LlmProviderConfigRepository providerConfigRepo,
                       ObjectMapper objectMapper,
                       LearnflowProperties properties) {
        this.clientFactory = clientFactory;
        this.providerConfigRepo = providerConfigRepo;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Bean
    public Agent<UserRequest, IntentAnalysis> intentAnalyzer() {
        return agent("intent_analyzer", AgentPrompts.INTENT_ANALYZER, IntentAnalysis.class);
    }

    @Bean
    public Agent<CurriculumRequest, RoadmapFramework> curriculumArchitect() {
        return agent("curriculum_architect", AgentPrompts.CURRICULUM_ARCHITECT, RoadmapFramework.class);
    }

    @Bean
    public Agent<ValidationRequest, ValidationResult> structureValidator() {
        return agent("structure_validator", AgentPrompts.STRUCTURE_VALIDATOR, ValidationResult.class);
    }

    @Bean
    public Agent<EditRequest, RoadmapFramework> roadmapEditor() {
        return agent("roadmap_editor", AgentPrompts.ROADMAP_EDITOR, RoadmapFramework.class);
    }

    @Bean
    public ContentGenerator tutorialGenerator(WebSearchClient search) {
        return new AgentContentGenerator(ContentType.TUTORIAL,
                this.<ContentGenerationInput, JsonNode>agent("tutorial_generator", AgentPrompts.TUTORIAL_GENERATOR, JsonNode.class),
                search);
    }

    @Bean
    public ContentGenerator resourceGenerator(WebSearchClient search) {
        return new AgentContentGenerator(ContentType.RESOURCE,
                this.<ContentGenerationInput, JsonNode>agent("resource_recommender", AgentPrompts.RESOURCE_RECOMMENDER, JsonNode.class),
                search);
    }

    @Bean
    public ContentGenerator quizGenerator(WebSearchClient search) {
        return new AgentContentGenerator(ContentType.QUIZ,
                this.<ContentGenerationInput, JsonNode>agent("quiz_generator", AgentPrompts.QUIZ_GENERATOR, JsonNode.class),
                search);
    }

    private <I, O> LlmBackedAgent<I, O> agent(String name, String systemPrompt, Class<O> outputType) {
        return new LlmBackedAgent<>(name, systemPrompt, outputType, clientFactory, providerConfigRepo,
                objectMapper, properties.getAgent());
    }
}
