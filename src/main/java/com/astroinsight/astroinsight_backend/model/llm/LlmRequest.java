package com.astroinsight.astroinsight_backend.model.llm;

/**
 * Provider-agnostic request built by the classifier port.
 * Each LlmClient implementation translates this into its provider's API format.
 */
public class LlmRequest {

    private String systemPrompt;
    private String userPrompt;
    private String model;
    private int    maxTokens   = 2000;
    private double temperature = 0.1;

    public LlmRequest() {}

    public LlmRequest(String userPrompt) {
        this.userPrompt = userPrompt;
    }

    public String getSystemPrompt() { return systemPrompt; }
    public String getUserPrompt()   { return userPrompt; }
    public String getModel()        { return model; }
    public int getMaxTokens()       { return maxTokens; }
    public double getTemperature()  { return temperature; }

    public void setSystemPrompt(String s) { this.systemPrompt = s; }
    public void setUserPrompt(String s)   { this.userPrompt = s; }
    public void setModel(String m)        { this.model = m; }
    public void setMaxTokens(int n)       { this.maxTokens = n; }
    public void setTemperature(double t)  { this.temperature = t; }
}
