package com.astroinsight.astroinsight_backend.handler.impl;

import com.astroinsight.astroinsight_backend.coder.CodeSynthesisLoop;
import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.dialogue.DialogueDecision;
import com.astroinsight.astroinsight_backend.dialogue.DialogueManager;
import com.astroinsight.astroinsight_backend.engine.CancellationRegistry;
import com.astroinsight.astroinsight_backend.explainer.Explanation;
import com.astroinsight.astroinsight_backend.explainer.ResultExplainer;
import com.astroinsight.astroinsight_backend.handler.NodeHandler;
import com.astroinsight.astroinsight_backend.handler.NodeResult;
import com.astroinsight.astroinsight_backend.model.code.CodeErrorType;
import com.astroinsight.astroinsight_backend.model.code.CodeTask;
import com.astroinsight.astroinsight_backend.model.code.ExecutionResult;
import com.astroinsight.astroinsight_backend.model.session.DialogueState;
import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.ErrorKind;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Clarifies a data-analysis request over several turns, hands it to the code synthesis loop
 * and explains a successful result.
 *
 * First entry opens a dialogue and suspends. Every later entry is one dialogue step: ASK and CONFIRM
 * suspend again on this node, CANCEL ends the request, PROCEED runs the loop. Loop failures are
 * reported as errors carrying the attempts already spent, so recovery can charge them to the
 * session's retry budget.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisualizationHandler implements NodeHandler {

    private static final int MAX_STDOUT_IN_ANSWER = 2_000;

    private final DialogueManager      dialogueManager;
    private final CodeSynthesisLoop    codeLoop;
    private final ResultExplainer      explainer;
    private final CancellationRegistry cancellations;
    private final AgentProperties      properties;

    @Override
    public NodeId supportedNode() {
        return NodeId.VISUALIZATION;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        DialogueState current = session.getDialogue();

        if (current == null || !current.isOpen()) {
            DialogueDecision opened = dialogueManager.start(userInput, properties.getDialogue().getMaxTurns());
            return suspend(opened, userInput);
        }

        DialogueDecision decision = dialogueManager.handle(current.copy(), userInput);
        switch (decision.action()) {
            case ASK:
            case CONFIRM:
                return suspend(decision, userInput);
            case CANCEL:
                return NodeResult.ok(SessionDelta.builder()
                        .dialogue(decision.state())
                        .awaitingUserChoice(false)
                        .answerText(decision.reply())
                        .record(ExecutionRecord.of(NodeId.VISUALIZATION, "dialogue_cancelled", userInput, decision.reply()))
                        .build(), NodeId.END);
            case PROCEED:
            default:
                return runCode(session, decision, userInput);
        }
    }

    private NodeResult suspend(DialogueDecision decision, String userInput) {
        return NodeResult.ok(SessionDelta.builder()
                .dialogue(decision.state())
                .awaitingUserChoice(true)
                .answerText(decision.reply())
                .record(ExecutionRecord.of(NodeId.VISUALIZATION, "dialogue_turn_" + decision.state().getTurnCount(),
                        userInput, decision.action().name()))
                .build(), NodeId.VISUALIZATION);
    }

    private NodeResult runCode(Session session, DialogueDecision decision, String userInput) {
        String request = dialogueManager.buildGenerationRequest(decision.state());
        log.info("[{}] Dialogue {} closed after {} turn(s), generating code",
                session.getSessionId(), decision.state().getDialogueId(), decision.state().getTurnCount());

        CodeTask task = codeLoop.run(session.getSessionId(), request, cancellations.tokenFor(session.getSessionId()));

        SessionDelta.SessionDeltaBuilder delta = SessionDelta.builder()
                .dialogue(decision.state())
                .awaitingUserChoice(false)
                .codeTask(task);
        if (task.getLatestCode() != null) {
            delta.generatedCode(task.getLatestCode());
        }

        if (task.isSucceeded()) {
            ExecutionResult result = task.getLatestResult();
            String answer = successAnswer(task, result);
            Optional<Explanation> explanation = explainer.explain(task);
            if (explanation.isPresent()) {
                answer = answer + "\n\n" + explanation.get().render();
            }
            return NodeResult.ok(delta
                    .generatedFiles(result.getGeneratedFiles())
                    .generatedTexts(result.getGeneratedTexts())
                    .answerText(answer)
                    .record(ExecutionRecord.of(NodeId.VISUALIZATION, "code_execution", userInput,
                            "success after " + task.getAttempt() + " attempt(s)"))
                    .build(), NodeId.END);
        }

        CodeErrorType failure = task.getFailureType();
        if (failure == CodeErrorType.CANCELLED) {
            return NodeResult.ok(delta
                    .answerText("Code execution was cancelled.")
                    .record(ExecutionRecord.of(NodeId.VISUALIZATION, "code_cancelled", userInput, task.getFailureMessage()))
                    .build(), NodeId.END);
        }

        ErrorKind kind = failure.isConfiguration() ? ErrorKind.CONFIGURATION
                : failure == CodeErrorType.EXECUTION_ERROR_MAX_RETRIES ? ErrorKind.EXECUTION
                : ErrorKind.SYNTAX;
        int consumed = failure.isConfiguration() ? 0 : task.getAttempt();
        ErrorInfo error = ErrorInfo.of(NodeId.VISUALIZATION, kind, failure.getKey() + ": " + task.getFailureMessage())
                .withRetriesConsumed(consumed);

        return NodeResult.err(error, delta
                .record(ExecutionRecord.of(NodeId.VISUALIZATION, "code_failed", userInput, failure.getKey()))
                .build());
    }

    private String successAnswer(CodeTask task, ExecutionResult result) {
        StringBuilder sb = new StringBuilder("Analysis completed");
        sb.append(" (dataset ").append(task.getDataset().name())
          .append(", complexity ").append(task.getComplexity())
          .append(", attempts ").append(task.getAttempt())
          .append(", ").append(result.getDurationMillis()).append(" ms).");

        String stdout = result.getStdout();
        if (stdout != null && !stdout.isBlank()) {
            String shown = stdout.length() > MAX_STDOUT_IN_ANSWER
                    ? stdout.substring(0, MAX_STDOUT_IN_ANSWER) + "\n..."
                    : stdout;
            sb.append("\n\nOutput:\n").append(shown);
        }
        appendFiles(sb, "Figures", result.getGeneratedFiles());
        appendFiles(sb, "Text results", result.getGeneratedTexts());
        return sb.toString();
    }

    private static void appendFiles(StringBuilder sb, String title, List<String> files) {
        if (files.isEmpty()) return;
        sb.append("\n\n").append(title).append(':');
        files.forEach(f -> sb.append("\n- ").append(f));
    }
}
