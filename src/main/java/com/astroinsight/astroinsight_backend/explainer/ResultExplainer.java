package com.astroinsight.astroinsight_backend.explainer;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.model.code.CodeTask;
import com.astroinsight.astroinsight_backend.model.code.ExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Last stage of the visualization pipeline: turns a successful code task into a short
 * summary and a list of insights, asked from the classifier with the request, the script's
 * printed output and the names of the files it produced.
 *
 * Explaining is best effort. A classifier failure, an empty reply or a task without a
 * successful result yields {@link Optional#empty()} and the plain result is shown instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultExplainer {

    private static final String SUMMARY_MARKER  = "summary:";
    private static final String INSIGHTS_MARKER = "insights:";

    private final ClassifierPort  classifier;
    private final AgentProperties properties;

    public Optional<Explanation> explain(CodeTask task) {
        AgentProperties.Explainer cfg = properties.getExplainer();
        ExecutionResult result = task.getLatestResult();
        if (!cfg.isEnabled() || !task.isSucceeded() || result == null) {
            return Optional.empty();
        }

        String reply;
        try {
            reply = classifier.classify(prompt(task, result, cfg));
        } catch (ClassifierException e) {
            log.warn("[{}] Explanation of task {} failed, showing the plain result: {}",
                    task.getSessionId(), task.getTaskId(), e.getMessage());
            return Optional.empty();
        }

        Optional<Explanation> explanation = parse(reply, cfg.getMaxInsights());
        if (explanation.isEmpty()) {
            log.warn("[{}] Explanation of task {} came back empty", task.getSessionId(), task.getTaskId());
        }
        return explanation;
    }

    // ── Prompt ────────────────────────────────────────────────────────────────

    static String prompt(CodeTask task, ExecutionResult result, AgentProperties.Explainer cfg) {
        String stdout = result.getStdout() == null ? "" : result.getStdout().strip();
        if (stdout.length() > cfg.getMaxStdoutChars()) {
            stdout = stdout.substring(0, cfg.getMaxStdoutChars()) + "\n...";
        }
        return """
                Explain the result of an astronomy data analysis to the user who asked for it.

                ## Request
                %s

                ## Dataset
                %s (complexity %s)

                ## Printed output
                %s

                ## Figures
                %s

                ## Text results
                %s

                Describe what the output and figures show, not how the code works.
                Reply in this format:
                SUMMARY: <one paragraph overview of the data and the main finding>
                INSIGHTS:
                - <insight backed by the output>
                Give at most %d insights.
                """.formatted(
                task.getRequest(),
                task.getDataset() != null ? task.getDataset().name() : "unknown",
                task.getComplexity(),
                stdout.isEmpty() ? "(none)" : stdout,
                fileNames(result.getGeneratedFiles()),
                fileNames(result.getGeneratedTexts()),
                cfg.getMaxInsights());
    }

    private static String fileNames(List<String> paths) {
        if (paths.isEmpty()) return "(none)";
        return paths.stream()
                .map(p -> "- " + Path.of(p).getFileName())
                .collect(Collectors.joining("\n"));
    }

    // ── Reply ─────────────────────────────────────────────────────────────────

    /**
     * Reads the SUMMARY / INSIGHTS layout. A reply that ignores it keeps its prose as the
     * summary and its bullet lines as insights.
     */
    static Optional<Explanation> parse(String reply, int maxInsights) {
        if (reply == null || reply.isBlank()) return Optional.empty();

        StringBuilder summary = new StringBuilder();
        List<String> insights = new ArrayList<>();
        boolean inInsights = false;

        for (String raw : reply.strip().split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            String lower = line.toLowerCase(Locale.ROOT);

            if (lower.startsWith(SUMMARY_MARKER)) {
                inInsights = false;
                appendSentence(summary, line.substring(SUMMARY_MARKER.length()).strip());
            } else if (lower.startsWith(INSIGHTS_MARKER)) {
                inInsights = true;
                String rest = line.substring(INSIGHTS_MARKER.length()).strip();
                if (!rest.isEmpty()) insights.add(rest);
            } else if (isBullet(line)) {
                insights.add(line.replaceFirst("^(?:[-*•]|\\d+[.)])\\s*", ""));
            } else if (inInsights) {
                insights.add(line);
            } else {
                appendSentence(summary, line);
            }
        }

        List<String> kept = insights.stream()
                .filter(i -> !i.isBlank())
                .limit(maxInsights)
                .collect(Collectors.toList());
        if (summary.length() == 0 && kept.isEmpty()) return Optional.empty();
        String text = summary.length() > 0 ? summary.toString() : "See the key insights below.";
        return Optional.of(new Explanation(text, kept));
    }

    private static boolean isBullet(String line) {
        return line.matches("^(?:[-*•]|\\d+[.)])\\s+.*");
    }

    private static void appendSentence(StringBuilder sb, String text) {
        if (text.isEmpty()) return;
        if (sb.length() > 0) sb.append(' ');
        sb.append(text);
    }
}
