package com.astroinsight.astroinsight_backend.engine;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.handler.ErrorRecoveryHandler;
import com.astroinsight.astroinsight_backend.handler.NodeHandlerRegistry;
import com.astroinsight.astroinsight_backend.handler.NodeResult;
import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.ErrorKind;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Drives a session through the node graph until it ends or waits for the user.
 *
 * How it works:
 *   1. Look up the handler of {@code currentStep} and run it
 *   2. An error result, a thrown exception or an illegal transition all become an
 *      {@link ErrorInfo} routed to {@code error_recovery}
 *   3. Apply the delta, record the node in {@code nodeHistory}
 *   4. Stop at END, or when the delta asked for user input (the session resumes on {@code next}),
 *      or when the step cap is hit
 *
 * The router is the only writer of {@code currentStep} and {@code nodeHistory}.
 * Callers must hold the session's lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRouter {

    private final NodeHandlerRegistry   handlers;
    private final SessionEventPublisher eventPublisher;
    private final AgentProperties       properties;

    // ── Public API ────────────────────────────────────────────────────────────

    public Session dispatch(Session session, String userInput) {
        String sessionId = session.getSessionId();
        int maxSteps = properties.getRouter().getMaxSteps();
        int steps = 0;
        session.setAwaitingUserChoice(false);

        while (true) {
            NodeId node = session.getCurrentStep();
            if (node.isTerminal()) {
                finish(session, null);
                return session;
            }
            if (steps >= maxSteps) {
                log.error("[{}] Dispatch stopped: {} steps without reaching an end", sessionId, maxSteps);
                fatal(session, ErrorInfo.of(node, ErrorKind.INTERNAL,
                        "Step limit of " + maxSteps + " exceeded; possible loop in routing"), "step limit exceeded");
                return session;
            }
            steps++;

            eventPublisher.nodeStarted(sessionId, node);
            log.info("[{}] Node {} started", sessionId, node);

            NodeResult result = invoke(node, session, userInput);
            if (!result.isError() && !allowedNext(node).contains(result.next())) {
                log.error("[{}] Illegal transition {} -> {}", sessionId, node, result.next());
                result = NodeResult.err(ErrorInfo.of(node, ErrorKind.INTERNAL,
                        "Illegal transition " + node + " -> " + result.next()));
            }

            if (result.isError() && node == NodeId.ERROR_RECOVERY) {
                session.getNodeHistory().add(node);
                eventPublisher.nodeFailed(sessionId, node, result.error().message());
                fatal(session, result.error(), "error recovery failed");
                return session;
            }

            SessionDelta delta = result.delta();
            session.apply(delta);
            if (result.isError()) {
                ErrorInfo error = result.error().atNode(node);
                session.setErrorInfo(error);
                session.setAwaitingUserChoice(false);
                session.record(ExecutionRecord.of(node, "error", userInput, error.kind() + ": " + error.message()));
                eventPublisher.nodeFailed(sessionId, node, error.message());
                log.warn("[{}] Node {} failed ({}): {}", sessionId, node, error.kind(), error.message());
            } else {
                if (session.getErrorInfo() != null && session.getErrorInfo().node() == node) {
                    session.setErrorInfo(null);
                }
                eventPublisher.nodeCompleted(sessionId, node, "SUCCESS");
                log.info("[{}] Node {} completed -> {}", sessionId, node, result.next());
            }
            session.getNodeHistory().add(node);

            NodeId next = result.next();
            if (next.isTerminal()) {
                finish(session, delta);
                return session;
            }
            session.setCurrentStep(next);
            if (session.isAwaitingUserChoice()) {
                eventPublisher.sessionSuspended(sessionId, next);
                log.info("[{}] Waiting for input at {}", sessionId, next);
                return session;
            }
        }
    }

    /** Static routing table. Every node except error recovery may also go to error recovery. */
    static Set<NodeId> allowedNext(NodeId from) {
        return switch (from) {
            case IDENTITY_CHECK -> EnumSet.of(NodeId.QA_AGENT, NodeId.TASK_SELECTOR, NodeId.ERROR_RECOVERY);
            case QA_AGENT       -> EnumSet.of(NodeId.END, NodeId.ERROR_RECOVERY);
            case TASK_SELECTOR  -> EnumSet.of(NodeId.CLASSIFICATION, NodeId.RETRIEVAL, NodeId.VISUALIZATION,
                                              NodeId.MULTIMARK, NodeId.ERROR_RECOVERY);
            case CLASSIFICATION -> EnumSet.of(NodeId.END, NodeId.ERROR_RECOVERY);
            case RETRIEVAL      -> EnumSet.of(NodeId.END, NodeId.ERROR_RECOVERY);
            case VISUALIZATION  -> EnumSet.of(NodeId.VISUALIZATION, NodeId.END, NodeId.ERROR_RECOVERY);
            case MULTIMARK      -> EnumSet.of(NodeId.END, NodeId.ERROR_RECOVERY);
            case ERROR_RECOVERY -> EnumSet.of(NodeId.CLASSIFICATION, NodeId.END);
            case END            -> EnumSet.noneOf(NodeId.class);
        };
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private NodeResult invoke(NodeId node, Session session, String userInput) {
        try {
            NodeResult result = handlers.get(node).handle(session, userInput);
            if (result == null) {
                return NodeResult.err(ErrorInfo.of(node, ErrorKind.INTERNAL, "Handler returned no result"));
            }
            return result;
        } catch (RuntimeException ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("[{}] Node {} threw: {}", session.getSessionId(), node, msg, ex);
            return NodeResult.err(ErrorInfo.of(node, ErrorKind.INTERNAL, msg));
        }
    }

    private void finish(Session session, SessionDelta delta) {
        session.setCurrentStep(NodeId.END);
        session.setAwaitingUserChoice(false);
        if (delta == null || delta.getComplete() == null || delta.getComplete()) {
            session.setComplete(true);
        }
        eventPublisher.sessionCompleted(session.getSessionId());
    }

    /** Last resort when recovery itself cannot run: end the request with a degraded answer. */
    private void fatal(Session session, ErrorInfo error, String reason) {
        session.setErrorInfo(error);
        session.setAnswerText(ErrorRecoveryHandler.degradedAnswer(error, session.getRetryCount(), reason));
        session.record(ExecutionRecord.of(NodeId.ERROR_RECOVERY, "fatal", error.message(), reason));
        session.setCurrentStep(NodeId.END);
        session.setAwaitingUserChoice(false);
        session.setComplete(true);
        eventPublisher.sessionCompleted(session.getSessionId());
    }
}
