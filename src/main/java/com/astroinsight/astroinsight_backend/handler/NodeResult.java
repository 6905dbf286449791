package com.astroinsight.astroinsight_backend.handler;

import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;

import java.util.Objects;

/**
 * Outcome of one node invocation: either a state update plus the next node,
 * or an error for the router to hand to error recovery.
 *
 * An error may still carry a partial delta (the code task of a failed loop, audit entries);
 * the router applies it before routing to recovery.
 */
public record NodeResult(SessionDelta delta, NodeId next, ErrorInfo error) {

    public static NodeResult ok(SessionDelta delta, NodeId next) {
        return new NodeResult(delta != null ? delta : SessionDelta.empty(), Objects.requireNonNull(next, "next"), null);
    }

    public static NodeResult err(ErrorInfo error) {
        return err(error, SessionDelta.empty());
    }

    public static NodeResult err(ErrorInfo error, SessionDelta partial) {
        return new NodeResult(partial != null ? partial : SessionDelta.empty(), NodeId.ERROR_RECOVERY,
                Objects.requireNonNull(error, "error"));
    }

    public boolean isError() {
        return error != null;
    }
}
