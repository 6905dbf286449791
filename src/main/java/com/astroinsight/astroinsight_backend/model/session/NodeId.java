package com.astroinsight.astroinsight_backend.model.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of nodes in the routing graph.
 * The key is the wire name exposed to front ends and written into node history.
 */
public enum NodeId {

    IDENTITY_CHECK("identity_check"),
    QA_AGENT("qa_agent"),
    TASK_SELECTOR("task_selector"),
    CLASSIFICATION("classification"),
    RETRIEVAL("retrieval"),
    VISUALIZATION("visualization"),
    MULTIMARK("multimark"),
    ERROR_RECOVERY("error_recovery"),
    END("__end__");  // terminal marker, never has a handler

    private final String key;

    NodeId(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() { return key; }

    public boolean isTerminal() { return this == END; }

    @Override
    public String toString() { return key; }
}
