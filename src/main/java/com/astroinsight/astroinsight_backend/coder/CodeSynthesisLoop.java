package com.astroinsight.astroinsight_backend.coder;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.engine.CancellationToken;
import com.astroinsight.astroinsight_backend.engine.CodeExecutor;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.exception.SandboxUnavailableException;
import com.astroinsight.astroinsight_backend.model.code.CodeErrorType;
import com.astroinsight.astroinsight_backend.model.code.CodeTask;
import com.astroinsight.astroinsight_backend.model.code.CodeTaskStatus;
import com.astroinsight.astroinsight_backend.model.code.Complexity;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;
import com.astroinsight.astroinsight_backend.model.code.ExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Generate → validate → execute → rewrite, bounded by {@code agent.coder.max-attempts}.
 *
 * How it works:
 *   1. Pick a dataset (terminal NO_DATASETS when there is none)
 *   2. Ask for a complexity rating; it only shapes the prompt
 *   3. For each attempt: generate, strip fences, parse-check, execute in its own directory
 *   4. Any failure feeds the previous code and its exact error into a rewrite prompt
 *   5. The first SUCCESS completes the task; an exhausted budget fails it
 *
 * The returned task is always terminal. Nothing is thrown for expected failures.
 * Attempt directories live at {@code <output-root>/<sessionId>/<taskId>/attempt-<n>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeSynthesisLoop {

    private final ClassifierPort  classifier;
    private final DatasetCatalog  catalog;
    private final DatasetSelector selector;
    private final SyntaxValidator syntaxValidator;
    private final CodeExecutor    executor;
    private final AgentProperties properties;

    /**
     * @throws IllegalArgumentException when the session id is not a single directory name
     *                                  under the output root
     */
    public CodeTask run(String sessionId, String request, CancellationToken token) {
        sessionDir(sessionId);
        CancellationToken cancel = token != null ? token : CancellationToken.none();
        CodeTask task = CodeTask.create(sessionId, request);
        log.info("[{}] Code task {} started", sessionId, task.getTaskId());

        try {
            List<DatasetInfo> datasets = catalog.list();
            Optional<DatasetInfo> dataset = selector.select(datasets, request);
            if (dataset.isEmpty()) {
                task.fail(CodeErrorType.NO_DATASETS,
                        "No datasets found in " + properties.getCoder().getDatasetDir());
                log.warn("[{}] Code task {} has no datasets", sessionId, task.getTaskId());
                return task;
            }
            task.setDataset(dataset.get());

            task.setStatus(CodeTaskStatus.COMPLEXITY_ANALYSIS);
            task.setComplexity(rateComplexity(request));

            generateAndRun(task, cancel);

        } catch (SandboxUnavailableException e) {
            log.error("[{}] Sandbox unavailable: {}", sessionId, e.getMessage());
            task.fail(CodeErrorType.SANDBOX_UNAVAILABLE, e.getMessage());
        }

        log.info("[{}] Code task {} ended {} after {} attempt(s)",
                sessionId, task.getTaskId(), task.getStatus(), task.getAttempt());
        return task;
    }

    // ── Attempts ──────────────────────────────────────────────────────────────

    private void generateAndRun(CodeTask task, CancellationToken cancel) {
        int maxAttempts = properties.getCoder().getMaxAttempts();
        DatasetInfo dataset = task.getDataset();
        String prompt = CodePrompts.generation(dataset, task.getRequest(), task.getComplexity());
        CodeErrorType lastError = null;
        String lastMessage = "";

        for (int n = 1; n <= maxAttempts; n++) {
            if (cancel.isCancelled()) {
                task.fail(CodeErrorType.CANCELLED, "Cancelled before attempt " + n);
                return;
            }
            task.setStatus(CodeTaskStatus.CODE_GENERATION);

            String code;
            try {
                code = CodeSanitizer.clean(classifier.classify(prompt));
            } catch (ClassifierException e) {
                code = "";
                task.addGeneratedCode(code);
                lastError   = CodeErrorType.GENERATION_ERROR;
                lastMessage = "Code generation failed: " + e.getMessage();
                task.recordError(lastError, code, lastMessage);
                log.warn("[{}] Attempt {}/{} generation failed: {}", task.getSessionId(), n, maxAttempts, e.getMessage());
                prompt = rewritePrompt(task, code, lastMessage, n + 1, maxAttempts);
                continue;
            }
            task.addGeneratedCode(code);

            SyntaxValidator.SyntaxCheck check = code.isBlank()
                    ? SyntaxValidator.SyntaxCheck.error("Generated code is empty")
                    : syntaxValidator.check(code);
            if (!check.valid()) {
                lastError   = CodeErrorType.SYNTAX_ERROR;
                lastMessage = check.message();
                task.recordError(lastError, code, lastMessage);
                log.warn("[{}] Attempt {}/{} syntax error: {}", task.getSessionId(), n, maxAttempts, lastMessage);
                prompt = rewritePrompt(task, code, lastMessage, n + 1, maxAttempts);
                continue;
            }

            task.setStatus(CodeTaskStatus.CODE_EXECUTION);
            ExecutionResult result = executor.execute(code, attemptDir(task, n),
                    properties.getExecutor().getTimeout(), cancel);
            task.getExecutionHistory().add(result);

            if (result.isSuccess()) {
                task.complete();
                return;
            }
            if (cancel.isCancelled()) {
                task.fail(CodeErrorType.CANCELLED, "Execution cancelled at attempt " + n);
                return;
            }

            task.setStatus(CodeTaskStatus.ERROR_RECOVERY);
            lastError   = CodeErrorType.EXECUTION_ERROR;
            lastMessage = result.errorMessage();
            task.recordError(lastError, code, lastMessage);
            log.warn("[{}] Attempt {}/{} execution {}: {}", task.getSessionId(), n, maxAttempts,
                    result.getStatus(), firstLine(lastMessage));
            prompt = rewritePrompt(task, code, lastMessage, n + 1, maxAttempts);
        }

        CodeErrorType terminal = lastError == CodeErrorType.EXECUTION_ERROR
                ? CodeErrorType.EXECUTION_ERROR_MAX_RETRIES
                : CodeErrorType.SYNTAX_ERROR_MAX_RETRIES;
        task.fail(terminal, "Giving up after " + maxAttempts + " attempt(s): " + lastMessage);
    }

    private Complexity rateComplexity(String request) {
        try {
            return Complexity.parse(classifier.classify(CodePrompts.complexity(request)));
        } catch (ClassifierException e) {
            log.warn("Complexity rating failed, using MODERATE: {}", e.getMessage());
            return Complexity.MODERATE;
        }
    }

    private String rewritePrompt(CodeTask task, String code, String error, int nextAttempt, int maxAttempts) {
        return CodePrompts.rewrite(task.getRequest(), code, error, task.getDataset(), nextAttempt, maxAttempts);
    }

    private Path attemptDir(CodeTask task, int attempt) {
        return sessionDir(task.getSessionId()).resolve(task.getTaskId()).resolve("attempt-" + attempt);
    }

    private Path sessionDir(String sessionId) {
        Path root = Paths.get(properties.getExecutor().getOutputRoot()).toAbsolutePath().normalize();
        Path dir = sessionId == null ? root : root.resolve(sessionId).normalize();
        if (!root.equals(dir.getParent())) {
            throw new IllegalArgumentException("Session id '" + sessionId + "' does not name a directory under " + root);
        }
        return dir;
    }

    private static String firstLine(String s) {
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
