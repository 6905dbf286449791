package com.astroinsight.astroinsight_backend.model.session;

import java.time.Instant;

/**
 * The error currently awaiting a recovery decision.
 *
 * @param retriesConsumed attempts already spent on this error before it reached recovery
 *                        (the code loop reports its rewrites here); zero for plain node failures
 */
public record ErrorInfo(
        NodeId    node,
        String    message,
        ErrorKind kind,
        int       retriesConsumed,
        Instant   timestamp
) {

    public static ErrorInfo of(NodeId node, ErrorKind kind, String message) {
        return new ErrorInfo(node, message, kind, 0, Instant.now());
    }

    public ErrorInfo withRetriesConsumed(int retries) {
        return new ErrorInfo(node, message, kind, retries, timestamp);
    }

    /** Same error re-attributed to another node (the router stamps the node that actually failed). */
    public ErrorInfo atNode(NodeId failedNode) {
        return new ErrorInfo(failedNode, message, kind, retriesConsumed, timestamp);
    }
}
