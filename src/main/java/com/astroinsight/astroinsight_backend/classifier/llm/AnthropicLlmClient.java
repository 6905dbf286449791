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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AnthropicLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmClient.class);
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultModel() { return "claude-3-5-haiku-latest"; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : LlmProvider.ANTHROPIC.getDefaultEndpoint();
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", req.getModel() != null && !req.getModel().isBlank() ? req.getModel() : getDefaultModel());
            body.put("max_tokens", req.getMaxTokens());
            body.put("temperature", req.getTemperature());
            body.put("messages", List.of(Map.of("role", "user", "content", req.getUserPrompt())));
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                body.put("system", req.getSystemPrompt());
            }
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(60))
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[Anthropic] HTTP {}", httpResp.statusCode());
                return LlmResponse.error("Anthropic API error " + httpResp.statusCode() + ": " + extractErrorMessage(httpResp.body()));
            }
            JsonNode resp = mapper.readTree(httpResp.body());
            StringBuilder text = new StringBuilder();
            for (JsonNode block : resp.path("content")) {
                if ("text".equals(block.path("type").asText())) {
                    text.append(block.path("text").asText(""));
                }
            }
            JsonNode usage = resp.path("usage");
            return LlmResponse.ok(text.toString(),
                    resp.path("model").asText(getDefaultModel()),
                    usage.path("input_tokens").asInt(0),
                    usage.path("output_tokens").asInt(0));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error("Anthropic call interrupted");
        } catch (Exception e) {
            log.error("[Anthropic] Exception calling API", e);
            return LlmResponse.error("Anthropic client exception: " + e.getMessage());
        }
    }

    private String extractErrorMessage(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (!msg.isMissingNode()) return msg.asText();
        } catch (Exception e) {
            log.debug("[Anthropic] Error body is not JSON: {}", e.getMessage());
        }
        return OpenAiCompatibleLlmClient.fallbackBody(body);
    }
}
