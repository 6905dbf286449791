package com.astroinsight.astroinsight_backend.classifier.llm;

import com.astroinsight.astroinsight_backend.model.domain.LlmProvider;
import com.astroinsight.astroinsight_backend.model.llm.LlmRequest;
import com.astroinsight.astroinsight_backend.model.llm.LlmResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for every provider speaking the OpenAI wire format
 * (OpenAI itself, DashScope compatible mode, Groq, Mistral, self-hosted gateways).
 * Plain text replies only: no response_format is requested.
 */
@Component
public class OpenAiCompatibleLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLlmClient.class);

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper = new ObjectMapper();

    private final LlmProvider provider;
    private final String defaultEndpoint;
    private final String defaultModel;

    public OpenAiCompatibleLlmClient() {
        this(LlmProvider.OPENAI, LlmProvider.OPENAI.getDefaultEndpoint(), "gpt-4o-mini");
    }

    public OpenAiCompatibleLlmClient(LlmProvider provider, String endpoint, String model) {
        this.provider        = provider;
        this.defaultEndpoint = endpoint;
        this.defaultModel    = model;
    }

    @Override
    public LlmProvider getProvider() { return provider; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : defaultEndpoint;
        if (url == null || url.isBlank()) {
            return LlmResponse.error(provider.getDisplayName() + " has no endpoint configured");
        }
        String model = (req.getModel() != null && !req.getModel().isBlank()) ? req.getModel() : defaultModel;
        try {
            List<Map<String, String>> messages = new ArrayList<>();
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
            }
            messages.add(Map.of("role", "user", "content", req.getUserPrompt()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", messages);
            body.put("max_tokens", req.getMaxTokens());
            body.put("temperature", req.getTemperature());
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(60))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[{}] HTTP {}", provider, httpResp.statusCode());
                return LlmResponse.error(provider.getDisplayName() + " API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
            }
            JsonNode resp = mapper.readTree(httpResp.body());
            JsonNode choice = resp.path("choices").path(0);
            if (choice.isMissingNode()) {
                return LlmResponse.error(provider.getDisplayName() + " returned no choices");
            }
            String text = choice.path("message").path("content").asText("");
            JsonNode usage = resp.path("usage");
            int inputTokens  = usage.path("prompt_tokens").asInt(0);
            int outputTokens = usage.path("completion_tokens").asInt(0);
            String usedModel = resp.path("model").asText(model);
            return LlmResponse.ok(text, usedModel, inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(provider.getDisplayName() + " call interrupted");
        } catch (Exception e) {
            log.error("[{}] Exception calling API", provider, e);
            return LlmResponse.error(provider.getDisplayName() + " client exception: " + e.getMessage());
        }
    }

    private String extractError(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (!msg.isMissingNode()) return msg.asText();
        } catch (Exception e) {
            log.debug("[{}] Error body is not JSON: {}", provider, e.getMessage());
        }
        return fallbackBody(body);
    }

    static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
