package com.astroinsight.astroinsight_backend.config;

import com.astroinsight.astroinsight_backend.model.domain.LlmProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * All tunables of the agent, bound from the {@code agent} namespace.
 *
 * <pre>
 * agent:
 *   router:
 *     max-retry: 3
 *     max-steps: 32
 *   dialogue:
 *     max-turns: 8
 *   coder:
 *     max-attempts: 3
 *     dataset-dir: ./dataset
 *   executor:
 *     interpreter: python3
 *     timeout: 60s
 *     output-root: ./output
 *   explainer:
 *     enabled: true
 *   llm:
 *     provider: DASHSCOPE
 *     api-key: ${LLM_API_KEY:}
 * </pre>
 *
 * Defaults are usable as-is, so tests can build one with {@code new AgentProperties()}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Router router = new Router();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Dialogue dialogue = new Dialogue();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Coder coder = new Coder();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Executor executor = new Executor();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Explainer explainer = new Explainer();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Llm llm = new Llm();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Events events = new Events();

    @Data
    public static class Router {
        /** Retry budget shared by error recovery and the code loop. */
        @Min(0) @Max(10)
        private int maxRetry = 3;

        /** Hard cap on node invocations per dispatch; exceeding it escalates. */
        @Min(4) @Max(1000)
        private int maxSteps = 32;
    }

    @Data
    public static class Dialogue {
        @Min(1) @Max(50)
        private int maxTurns = 8;
    }

    @Data
    public static class Coder {
        @Min(1) @Max(10)
        private int maxAttempts = 3;

        @NotBlank
        private String datasetDir = "./dataset";
    }

    @Data
    public static class Executor {
        @NotBlank
        private String interpreter = "python3";

        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        @NotBlank
        private String outputRoot = "./output";

        /** Per-stream capture cap; the rest is drained and dropped. */
        @Min(1024)
        private int maxOutputBytes = 1024 * 1024;

        /** How long to wait for a killed process to be reaped. */
        @NotNull
        private Duration killGrace = Duration.ofSeconds(2);

        /** Timeout for the parse-only syntax check subprocess. */
        @NotNull
        private Duration syntaxCheckTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Explainer {
        /** When off, visualization answers carry the raw result only. */
        private boolean enabled = true;

        @Min(1) @Max(20)
        private int maxInsights = 5;

        /** How much of the script's stdout goes into the explanation prompt. */
        @Min(200)
        private int maxStdoutChars = 1500;
    }

    @Data
    public static class Llm {
        @NotNull
        private LlmProvider provider = LlmProvider.DASHSCOPE;

        private String apiKey   = "";
        private String model    = "";
        private String endpoint = "";

        @Min(1)
        private int maxTokens = 2000;

        private double temperature = 0.1;
    }

    @Data
    public static class Events {
        @Valid
        @NotNull
        private Redis redis = new Redis();

        @Data
        public static class Redis {
            /** Fan session events out through Redis pub/sub so every instance can deliver them. */
            private boolean enabled = false;
        }
    }
}
