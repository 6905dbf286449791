package com.astroinsight.astroinsight_backend.model.code;

public enum CodeTaskStatus {
    DATASET_SELECTION,
    COMPLEXITY_ANALYSIS,
    CODE_GENERATION,
    CODE_EXECUTION,
    ERROR_RECOVERY,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
