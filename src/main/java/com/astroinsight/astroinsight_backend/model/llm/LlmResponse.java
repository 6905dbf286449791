package com.astroinsight.astroinsight_backend.model.llm;

/**
 * Provider-agnostic response returned by every LlmClient.
 * Transport and provider failures come back as {@code success = false}, never as exceptions.
 */
public class LlmResponse {

    private boolean success;
    private String  rawText;       // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private int     inputTokens;
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

    // ── Getters ────────────────────────────────────────────────────────────

    public boolean isSuccess()      { return success; }
    public String getRawText()      { return rawText; }
    public String getErrorMessage() { return errorMessage; }
    public int getInputTokens()     { return inputTokens; }
    public int getOutputTokens()    { return outputTokens; }
    public String getModel()        { return model; }
}
