package com.astroinsight.astroinsight_backend.handler.impl;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.handler.NodeHandler;
import com.astroinsight.astroinsight_backend.handler.NodePrompts;
import com.astroinsight.astroinsight_backend.handler.NodeResult;
import com.astroinsight.astroinsight_backend.model.session.ClassificationResult;
import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.ErrorKind;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names the object in the request by catalog designation and asks the classifier for its category.
 * A classifier failure is reported as a retryable error; an unknown label becomes {@code unknown}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClassificationHandler implements NodeHandler {

    static final List<String> CATEGORIES = List.of(
            "star", "planet", "galaxy", "nebula", "star_cluster", "quasar", "supernova_remnant", "unknown");

    static final String UNKNOWN_OBJECT = "Unknown";

    // Messier, NGC, IC, Henry Draper, Hipparcos, SDSS designations
    private static final List<Pattern> DESIGNATIONS = List.of(
            Pattern.compile("\\bM\\s?\\d{1,3}\\b"),
            Pattern.compile("\\bNGC\\s?\\d{1,4}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bIC\\s?\\d{1,4}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bHD\\s?\\d{1,6}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bHIP\\s?\\d{1,6}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bSDSS\\s?J\\d{6}(?:\\.\\d+)?[+-]\\d{6}(?:\\.\\d+)?", Pattern.CASE_INSENSITIVE));

    private final ClassifierPort classifier;

    @Override
    public NodeId supportedNode() {
        return NodeId.CLASSIFICATION;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        String objectName = extractObjectName(userInput);

        String raw;
        try {
            raw = classifier.classify(NodePrompts.classification(userInput, objectName, CATEGORIES));
        } catch (ClassifierException e) {
            return NodeResult.err(ErrorInfo.of(NodeId.CLASSIFICATION, ErrorKind.CLASSIFIER,
                    "Classification failed: " + e.getMessage()));
        }
        String category = resolveCategory(raw);
        ClassificationResult result = new ClassificationResult(objectName, category, raw);

        String answer = UNKNOWN_OBJECT.equals(objectName)
                ? "The object could not be identified by name. Best-matching category: " + category + "."
                : objectName + " is classified as: " + category + ".";

        return NodeResult.ok(SessionDelta.builder()
                .classification(result)
                .answerText(answer)
                .record(ExecutionRecord.of(NodeId.CLASSIFICATION, "classify", userInput, objectName + " -> " + category))
                .build(), NodeId.END);
    }

    static String extractObjectName(String input) {
        if (input == null) return UNKNOWN_OBJECT;
        for (Pattern p : DESIGNATIONS) {
            Matcher m = p.matcher(input);
            if (m.find()) {
                return m.group().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
            }
        }
        return UNKNOWN_OBJECT;
    }

    static String resolveCategory(String raw) {
        if (raw == null) return "unknown";
        String lower = raw.strip().toLowerCase(Locale.ROOT).replace(' ', '_');
        if (CATEGORIES.contains(lower)) return lower;
        for (String c : CATEGORIES) {
            if (!c.equals("unknown") && lower.contains(c)) return c;
        }
        log.warn("Unrecognised category '{}', using unknown", raw);
        return "unknown";
    }
}
