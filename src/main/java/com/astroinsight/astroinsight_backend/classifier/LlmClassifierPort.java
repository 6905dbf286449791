package com.astroinsight.astroinsight_backend.classifier;

import com.astroinsight.astroinsight_backend.classifier.llm.LlmClient;
import com.astroinsight.astroinsight_backend.classifier.llm.LlmClientFactory;
import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.model.llm.LlmRequest;
import com.astroinsight.astroinsight_backend.model.llm.LlmResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Classifier port backed by the configured LLM provider. */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClassifierPort implements ClassifierPort {

    private final LlmClientFactory clientFactory;
    private final AgentProperties  properties;

    @Override
    public String classify(String prompt) throws ClassifierException {
        AgentProperties.Llm cfg = properties.getLlm();
        LlmClient client;
        try {
            client = clientFactory.getClient(cfg.getProvider());
        } catch (IllegalArgumentException e) {
            throw new ClassifierException(e.getMessage(), e);
        }

        LlmRequest request = new LlmRequest(prompt);
        request.setModel(cfg.getModel());
        request.setMaxTokens(cfg.getMaxTokens());
        request.setTemperature(cfg.getTemperature());

        long started = System.currentTimeMillis();
        LlmResponse response = client.call(request, cfg.getApiKey(), cfg.getEndpoint());
        if (!response.isSuccess()) {
            throw new ClassifierException(response.getErrorMessage());
        }
        log.debug("[{}] {} in {} ms, tokens in={} out={}", cfg.getProvider(), response.getModel(),
                System.currentTimeMillis() - started, response.getInputTokens(), response.getOutputTokens());
        return response.getRawText() != null ? response.getRawText() : "";
    }
}
