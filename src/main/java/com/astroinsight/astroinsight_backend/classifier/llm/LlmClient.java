package com.astroinsight.astroinsight_backend.classifier.llm;

import com.astroinsight.astroinsight_backend.model.domain.LlmProvider;
import com.astroinsight.astroinsight_backend.model.llm.LlmRequest;
import com.astroinsight.astroinsight_backend.model.llm.LlmResponse;

public interface LlmClient {

    LlmProvider getProvider();

    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    String getDefaultModel();
}
