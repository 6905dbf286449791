package com.astroinsight.astroinsight_backend.model.domain;

/**
 * LLM providers the classifier port can talk to.
 * Each provider maps to a concrete LlmClient implementation.
 */
public enum LlmProvider {

    ANTHROPIC("Anthropic Claude",      "https://api.anthropic.com/v1/messages"),
    OPENAI("OpenAI GPT",               "https://api.openai.com/v1/chat/completions"),
    DASHSCOPE("Alibaba DashScope",     "https://dashscope.aliyuncs.com/compatible-mode/v1/chat/completions"),
    GROQ("Groq (Fast inference)",      "https://api.groq.com/openai/v1/chat/completions"),
    MISTRAL("Mistral AI",              "https://api.mistral.ai/v1/chat/completions"),
    CUSTOM("Custom / Self-hosted",     "");  // endpoint comes from agent.llm.endpoint

    private final String displayName;
    private final String defaultEndpoint;

    LlmProvider(String displayName, String defaultEndpoint) {
        this.displayName     = displayName;
        this.defaultEndpoint = defaultEndpoint;
    }

    public String getDisplayName()     { return displayName; }
    public String getDefaultEndpoint() { return defaultEndpoint; }
}
