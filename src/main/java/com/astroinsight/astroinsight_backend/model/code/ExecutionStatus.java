package com.astroinsight.astroinsight_backend.model.code;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    ERROR,
    TIMEOUT;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == TIMEOUT;
    }
}
