package com.astroinsight.astroinsight_backend.classifier;

import com.astroinsight.astroinsight_backend.exception.ClassifierException;

/**
 * Text in, text out. The single boundary every node uses for an LLM decision.
 *
 * Implementations do not retry; retry policy lives in error recovery. Callers must validate
 * the reply against their own allowed set and fall back to a documented default.
 */
@FunctionalInterface
public interface ClassifierPort {

    String classify(String prompt) throws ClassifierException;
}
