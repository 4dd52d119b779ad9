package com.learnflow.learnflow_backend.model.llm;

/**
 * Provider-agnostic request that LlmBackedAgent builds.
 * Each LlmClient implementation translates this into its provider's API format.
 */
public class LlmRequest {

    private String systemPrompt;
    private String userPrompt;
    private String model;
    private int maxTokens = 4000;
    private double temperature = 0.2;
    private boolean jsonOutput = true;

    public LlmRequest() {}

    public LlmRequest(String systemPrompt, String userPrompt, String model) {
        this.systemPrompt = systemPrompt;
        this.userPrompt = userPrompt;
        this.model = model;
    }

    public String getSystemPrompt() { return systemPrompt; }
    public String getUserPrompt() { return userPrompt; }
    public String getModel() { return model; }
    public int getMaxTokens() { return maxTokens; }
    public double getTemperature() { return temperature; }
    public boolean isJsonOutput() { return jsonOutput; }

    public void setSystemPrompt(String s) { this.systemPrompt = s; }
    public void setUserPrompt(String s) { this.userPrompt = s; }
    public void setModel(String m) { this.model = m; }
    public void setMaxTokens(int n) { this.maxTokens = n; }
    public void setTemperature(double t) { this.temperature = t; }
    public void setJsonOutput(boolean b) { this.jsonOutput = b; }
}
