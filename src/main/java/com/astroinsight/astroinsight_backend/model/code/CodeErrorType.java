package com.astroinsight.astroinsight_backend.model.code;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CodeErrorType {

    // Per-attempt errors, retried through a rewrite
    SYNTAX_ERROR,
    EXECUTION_ERROR,
    GENERATION_ERROR,

    // Terminal failures
    NO_DATASETS,
    SANDBOX_UNAVAILABLE,
    SYNTAX_ERROR_MAX_RETRIES,
    EXECUTION_ERROR_MAX_RETRIES,
    CANCELLED;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Configuration problems end the task immediately and never touch the retry budget. */
    public boolean isConfiguration() {
        return this == NO_DATASETS || this == SANDBOX_UNAVAILABLE;
    }
}
