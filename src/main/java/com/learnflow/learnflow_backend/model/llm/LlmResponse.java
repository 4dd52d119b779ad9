package com.learnflow.learnflow_backend.model.llm;

/**
 * Provider-agnostic response returned by every LlmClient.
 * The raw text is always the model's reply.
 */
public class LlmResponse {

    private boolean success;
    private String  rawText;       // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private int     inputTokens;   // for cost logging
    private int     outputTokens;
    private String  model;         // actual model used (provider may differ from requested)

    public LlmResponse() {}

    public static LlmResponse ok(String rawText, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.rawText      = rawText;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse error(String message) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.errorMessage = message;
        return r;
    }

    public boolean isSuccess()           { return success; }
    public String getRawText()           { return rawText; }
    public String getErrorMessage()      { return errorMessage; }
    public int getInputTokens()          { return inputTokens; }
    public int getOutputTokens()         { return outputTokens; }
    public String getModel()             { return model; }
}
