package com.astroinsight.astroinsight_backend.classifier.llm;

import com.astroinsight.astroinsight_backend.model.domain.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(List<LlmClient> clients) {
        for (LlmClient client : clients) {
            clientMap.put(client.getProvider(), client);
        }
        register(LlmProvider.DASHSCOPE, "qwen-plus");
        register(LlmProvider.GROQ,      "llama-3.3-70b-versatile");
        register(LlmProvider.MISTRAL,   "mistral-small-latest");
        register(LlmProvider.CUSTOM,    "");
    }

    private void register(LlmProvider provider, String defaultModel) {
        clientMap.putIfAbsent(provider,
                new OpenAiCompatibleLlmClient(provider, provider.getDefaultEndpoint(), defaultModel));
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No LlmClient registered for provider: " + provider);
        }
        return client;
    }
}
