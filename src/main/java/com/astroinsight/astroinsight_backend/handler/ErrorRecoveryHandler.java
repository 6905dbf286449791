package com.astroinsight.astroinsight_backend.handler;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.ErrorKind;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides what happens after a node failed. The only writer of {@code retryCount}.
 *
 * Policy, evaluated after folding the failure's own consumed retries into the counter:
 *   - budget exhausted, or the same node failing twice in a row → escalate
 *   - classification failure → count a retry and run classification again
 *   - anything else → escalate, it is not retryable
 *
 * Escalation ends the request with a degraded answer. Every decision leaves one audit entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorRecoveryHandler implements NodeHandler {

    static final String REASON_BUDGET     = "retry budget exhausted";
    static final String REASON_LOOP       = "loop detected";
    static final String REASON_NOT_RETRY  = "not retryable";

    private final AgentProperties properties;

    @Override
    public NodeId supportedNode() {
        return NodeId.ERROR_RECOVERY;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        int maxRetry = properties.getRouter().getMaxRetry();
        ErrorInfo error = session.getErrorInfo() != null
                ? session.getErrorInfo()
                : ErrorInfo.of(NodeId.ERROR_RECOVERY, ErrorKind.INTERNAL, "Recovery entered without an error");

        int retryCount = Math.min(maxRetry, Math.max(session.getRetryCount(), error.retriesConsumed()));

        if (retryCount >= maxRetry) {
            return escalate(session, error, retryCount, REASON_BUDGET);
        }
        if (error.node() == session.getLastErrorNode() && retryCount > 0) {
            return escalate(session, error, retryCount, REASON_LOOP);
        }

        if (error.node() == NodeId.CLASSIFICATION) {
            int next = retryCount + 1;
            log.warn("[{}] Retrying {} ({}/{}): {}", session.getSessionId(), error.node(), next, maxRetry, error.message());
            return NodeResult.ok(SessionDelta.builder()
                    .retryCount(next)
                    .lastErrorNode(error.node())
                    .complete(false)
                    .record(ExecutionRecord.of(NodeId.ERROR_RECOVERY, "retry", error.message(),
                            "retry " + next + " of " + maxRetry + " for " + error.node()))
                    .build(), NodeId.CLASSIFICATION);
        }

        return escalate(session, error, retryCount, REASON_NOT_RETRY);
    }

    private NodeResult escalate(Session session, ErrorInfo error, int retryCount, String reason) {
        log.error("[{}] Escalating failure of {} after {} retries ({}): {}",
                session.getSessionId(), error.node(), retryCount, reason, error.message());
        String answer = degradedAnswer(error, retryCount, reason);
        return NodeResult.ok(SessionDelta.builder()
                .retryCount(retryCount)
                .lastErrorNode(error.node())
                .complete(true)
                .awaitingUserChoice(false)
                .answerText(answer)
                .record(ExecutionRecord.of(NodeId.ERROR_RECOVERY, "escalate", error.message(), reason))
                .build(), NodeId.END);
    }

    public static String degradedAnswer(ErrorInfo error, int retryCount, String reason) {
        return "Sorry, the request could not be completed.\n"
                + "Step: " + error.node() + "\n"
                + "Error: " + error.message() + "\n"
                + "Retries: " + retryCount + "\n"
                + "Reason: " + reason + "\n"
                + "Please rephrase the request or try again later.";
    }
}
