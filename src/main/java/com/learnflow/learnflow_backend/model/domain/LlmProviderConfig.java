package com.learnflow.learnflow_backend.model.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Stored credentials for the LLM provider an agent runs on. Separate from
 * {@link ApiCredential}, which holds the rate-limited search keys.
 */
@Entity
@Table(name = "llm_provider_configs")
public class LlmProviderConfig {

    @Id
    @GeneratedValue
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, unique = true)
    private LlmProvider provider;

    @Column(name = "api_key", nullable = false)
    private String apiKey;

    @Column(name = "custom_endpoint")
    private String customEndpoint;

    @Column(name = "default_model")
    private String defaultModel;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() { this.updatedAt = Instant.now(); }

    public UUID getId() { return id; }
    public LlmProvider getProvider() { return provider; }
    public String getApiKey() { return apiKey; }
    public String getCustomEndpoint() { return customEndpoint; }
    public String getDefaultModel() { return defaultModel; }
    public boolean isEnabled() { return enabled; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setId(UUID id) { this.id = id; }
    public void setProvider(LlmProvider provider) { this.provider = provider; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public void setCustomEndpoint(String ep) { this.customEndpoint = ep; }
    public void setDefaultModel(String model) { this.defaultModel = model; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public void setUpdatedAt(Instant t) { this.updatedAt = t; }
}
