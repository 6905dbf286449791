package com.astroinsight.astroinsight_backend.exception;

import lombok.Getter;

/** The interpreter process could not be spawned. Configuration problem, never retried. */
@Getter
public class SandboxUnavailableException extends RuntimeException {

    private final String interpreter;

    public SandboxUnavailableException(String interpreter, Throwable cause) {
        super("Cannot start interpreter '" + interpreter + "': " + cause.getMessage(), cause);
        this.interpreter = interpreter;
    }
}
