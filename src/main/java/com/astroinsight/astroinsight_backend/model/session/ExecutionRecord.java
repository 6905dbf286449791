package com.astroinsight.astroinsight_backend.model.session;

import java.time.Instant;

/** One audit entry in a session's execution history. Append-only. */
public record ExecutionRecord(
        NodeId  node,
        String  action,
        String  input,
        String  output,
        Instant timestamp
) {

    public static ExecutionRecord of(NodeId node, String action, String input, String output) {
        return new ExecutionRecord(node, action, input, output, Instant.now());
    }
}
