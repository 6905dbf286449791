package com.astroinsight.astroinsight_backend.model.session;

public enum ErrorKind {
    INPUT,          // malformed or missing user input
    CLASSIFIER,     // LLM unreachable, timed out or refused
    SYNTAX,         // generated code failed static validation
    EXECUTION,      // generated code failed or timed out when run
    CONFIGURATION,  // no datasets, interpreter missing
    INTERNAL        // handler bug, illegal transition, step cap
}
