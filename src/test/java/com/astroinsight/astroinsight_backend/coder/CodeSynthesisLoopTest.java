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
import com.astroinsight.astroinsight_backend.model.code.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Code synthesis loop")
class CodeSynthesisLoopTest {

    private static final DatasetInfo STARS    = new DatasetInfo("stars", "/data/stars.csv", List.of("ra", "dec", "mag"));
    private static final DatasetInfo GALAXIES = new DatasetInfo("galaxies", "/data/galaxies.csv", List.of("z", "type"));

    @Mock
    private DatasetCatalog catalog;

    @Mock
    private SyntaxValidator syntaxValidator;

    @Mock
    private CodeExecutor executor;

    @TempDir
    Path outputRoot;

    private ScriptedClassifier classifier;
    private CodeSynthesisLoop loop;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getExecutor().setOutputRoot(outputRoot.toString());
        properties.getCoder().setMaxAttempts(3);

        classifier = new ScriptedClassifier();
        loop = new CodeSynthesisLoop(classifier, catalog, new DatasetSelector(classifier),
                syntaxValidator, executor, properties);
    }

    @Test
    @DisplayName("Single dataset, first attempt succeeds without a selection call")
    void firstAttemptSucceeds() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS));
        classifier.complexity = "SIMPLE";
        classifier.codeReplies.add("```python\nprint('ok')\n```");
        when(syntaxValidator.check("print('ok')")).thenReturn(SyntaxValidator.SyntaxCheck.ok());
        when(executor.execute(anyString(), any(Path.class), any(Duration.class), any(CancellationToken.class)))
                .thenReturn(success());

        // When
        CodeTask task = loop.run("s1", "plot ra against dec", CancellationToken.none());

        // Then
        assertThat(task.getStatus()).isEqualTo(CodeTaskStatus.COMPLETED);
        assertThat(task.getDataset()).isEqualTo(STARS);
        assertThat(task.getComplexity()).isEqualTo(Complexity.SIMPLE);
        assertThat(task.getAttempt()).isEqualTo(1);
        assertThat(task.getCodeHistory()).hasSize(1);
        assertThat(task.getLatestCode()).isEqualTo("print('ok')");
        assertThat(task.getExecutionHistory()).hasSize(1);
        assertThat(classifier.prompts).noneMatch(p -> p.contains("Pick the dataset"));

        ArgumentCaptor<Path> dir = ArgumentCaptor.forClass(Path.class);
        verify(executor).execute(anyString(), dir.capture(), any(Duration.class), any(CancellationToken.class));
        assertThat(dir.getValue()).isEqualTo(outputRoot.resolve("s1").resolve(task.getTaskId()).resolve("attempt-1"));
    }

    @Test
    @DisplayName("A syntax error is fed into the rewrite prompt and the second attempt succeeds")
    void syntaxErrorThenSuccess() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS));
        classifier.codeReplies.add("print('broken'");
        classifier.codeReplies.add("print('fixed')");
        when(syntaxValidator.check("print('broken'"))
                .thenReturn(SyntaxValidator.SyntaxCheck.error("SyntaxError: '(' was never closed (line 1)"));
        when(syntaxValidator.check("print('fixed')")).thenReturn(SyntaxValidator.SyntaxCheck.ok());
        when(executor.execute(anyString(), any(Path.class), any(Duration.class), any(CancellationToken.class)))
                .thenReturn(success());

        // When
        CodeTask task = loop.run("s2", "show the magnitude histogram", CancellationToken.none());

        // Then
        assertThat(task.getStatus()).isEqualTo(CodeTaskStatus.COMPLETED);
        assertThat(task.getCodeHistory()).hasSize(2);
        assertThat(task.getAttempt()).isEqualTo(2);
        assertThat(task.getErrors()).singleElement()
                .satisfies(e -> assertThat(e.type()).isEqualTo(CodeErrorType.SYNTAX_ERROR));

        String rewrite = classifier.generationPrompts().get(1);
        assertThat(rewrite).contains("print('broken'");
        assertThat(rewrite).contains("SyntaxError: '(' was never closed (line 1)");
        assertThat(rewrite).contains("attempt 2 of 3");

        verify(executor, times(1)).execute(anyString(), any(Path.class), any(Duration.class), any(CancellationToken.class));
    }

    @Test
    @DisplayName("Code that fails the syntax check never reaches the executor")
    void invalidCodeIsNeverExecuted() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS));
        classifier.codeReplies.add("def (");
        classifier.codeReplies.add("def (");
        classifier.codeReplies.add("def (");
        when(syntaxValidator.check("def (")).thenReturn(SyntaxValidator.SyntaxCheck.error("SyntaxError: invalid syntax (line 1)"));

        // When
        CodeTask task = loop.run("s3", "plot", CancellationToken.none());

        // Then
        assertThat(task.getStatus()).isEqualTo(CodeTaskStatus.FAILED);
        assertThat(task.getFailureType()).isEqualTo(CodeErrorType.SYNTAX_ERROR_MAX_RETRIES);
        assertThat(task.getCodeHistory()).hasSize(3);
        assertThat(task.getExecutionHistory()).isEmpty();
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("Three execution failures exhaust the attempt budget")
    void executionFailuresExhaustBudget() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS));
        for (int i = 0; i < 3; i++) classifier.codeReplies.add("print(df['magnitude'])");
        when(syntaxValidator.check(anyString())).thenReturn(SyntaxValidator.SyntaxCheck.ok());
        when(executor.execute(anyString(), any(Path.class), any(Duration.class), any(CancellationToken.class)))
                .thenAnswer(inv -> failure("KeyError: 'magnitude'"));

        // When
        CodeTask task = loop.run("s4", "average magnitude", CancellationToken.none());

        // Then
        assertThat(task.getStatus()).isEqualTo(CodeTaskStatus.FAILED);
        assertThat(task.getFailureType()).isEqualTo(CodeErrorType.EXECUTION_ERROR_MAX_RETRIES);
        assertThat(task.getFailureMessage()).startsWith("Giving up after 3 attempt(s)").contains("KeyError");
        assertThat(task.getAttempt()).isEqualTo(3);
        assertThat(task.getExecutionHistory()).hasSize(3);
        assertThat(task.getErrors()).extracting(e -> e.type()).containsOnly(CodeErrorType.EXECUTION_ERROR);
        assertThat(classifier.generationPrompts().get(2)).contains("KeyError: 'magnitude'").contains("attempt 3 of 3");
    }

    @Test
    @DisplayName("No datasets ends the task at once without generating anything")
    void noDatasets() {
        // Given
        when(catalog.list()).thenReturn(List.of());

        // When
        CodeTask task = loop.run("s5", "plot anything", CancellationToken.none());

        // Then
        assertThat(task.getStatus()).isEqualTo(CodeTaskStatus.FAILED);
        assertThat(task.getFailureType()).isEqualTo(CodeErrorType.NO_DATASETS);
        assertThat(task.getCodeHistory()).isEmpty();
        assertThat(classifier.prompts).isEmpty();
        verifyNoInteractions(executor, syntaxValidator);
    }

    @Test
    @DisplayName("With several datasets the classifier's pick is used")
    void selectsNamedDataset() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS, GALAXIES));
        classifier.selection = "2";
        classifier.codeReplies.add("print(1)");
        when(syntaxValidator.check(anyString())).thenReturn(SyntaxValidator.SyntaxCheck.ok());
        when(executor.execute(anyString(), any(Path.class), any(Duration.class), any(CancellationToken.class)))
                .thenReturn(success());

        // When
        CodeTask task = loop.run("s6", "redshift distribution of galaxies", CancellationToken.none());

        // Then
        assertThat(task.getDataset()).isEqualTo(GALAXIES);
        assertThat(classifier.generationPrompts().get(0)).contains("/data/galaxies.csv");
    }

    @Test
    @DisplayName("A failed generation call counts as an attempt and is retried")
    void generationFailureIsRetried() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS));
        classifier.codeReplies.add(new ClassifierException("HTTP 503"));
        classifier.codeReplies.add("print(2)");
        when(syntaxValidator.check("print(2)")).thenReturn(SyntaxValidator.SyntaxCheck.ok());
        when(executor.execute(anyString(), any(Path.class), any(Duration.class), any(CancellationToken.class)))
                .thenReturn(success());

        // When
        CodeTask task = loop.run("s7", "plot", CancellationToken.none());

        // Then
        assertThat(task.getStatus()).isEqualTo(CodeTaskStatus.COMPLETED);
        assertThat(task.getAttempt()).isEqualTo(2);
        assertThat(task.getErrors()).singleElement()
                .satisfies(e -> assertThat(e.type()).isEqualTo(CodeErrorType.GENERATION_ERROR));
    }

    @Test
    @DisplayName("A missing interpreter is a configuration failure, not a retry")
    void sandboxUnavailable() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS));
        classifier.codeReplies.add("print(3)");
        when(syntaxValidator.check(anyString()))
                .thenThrow(new SandboxUnavailableException("python3", new IOException("No such file or directory")));

        // When
        CodeTask task = loop.run("s8", "plot", CancellationToken.none());

        // Then
        assertThat(task.getStatus()).isEqualTo(CodeTaskStatus.FAILED);
        assertThat(task.getFailureType()).isEqualTo(CodeErrorType.SANDBOX_UNAVAILABLE);
        assertThat(task.getFailureMessage()).contains("python3");
        assertThat(task.getCodeHistory()).hasSize(1);
        verify(executor, never()).execute(anyString(), any(Path.class), any(Duration.class), any(CancellationToken.class));
    }

    @Test
    @DisplayName("A cancelled token stops the loop before any code is generated")
    void cancelledBeforeGeneration() {
        // Given
        when(catalog.list()).thenReturn(List.of(STARS));
        CancellationToken token = new CancellationToken();
        token.cancel();

        // When
        CodeTask task = loop.run("s9", "plot", token);

        // Then
        assertThat(task.getFailureType()).isEqualTo(CodeErrorType.CANCELLED);
        assertThat(task.getCodeHistory()).isEmpty();
        verifyNoInteractions(executor);
    }

    @ParameterizedTest
    @ValueSource(strings = {"../../escaped", "..", "nested/dir", "/etc"})
    @DisplayName("A session id that would leave the output root is rejected before any work")
    void sessionIdMustStayUnderOutputRoot(String sessionId) {
        // When / Then
        assertThatThrownBy(() -> loop.run(sessionId, "plot", CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not name a directory under");
        assertThat(classifier.prompts).isEmpty();
        verifyNoInteractions(catalog, executor);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static ExecutionResult success() {
        return ExecutionResult.start("/tmp/out").finish(ExecutionStatus.SUCCESS, "done", "", 0, false,
                List.of("/tmp/out/plot.png"), List.of());
    }

    private static ExecutionResult failure(String stderr) {
        return ExecutionResult.start("/tmp/out").finish(ExecutionStatus.ERROR, "", stderr, 1, false,
                List.of(), List.of());
    }

    /** Answers selection and complexity prompts from fields, code prompts from a queue. */
    private static final class ScriptedClassifier implements ClassifierPort {

        final List<String>  prompts     = new ArrayList<>();
        final Deque<Object> codeReplies = new ArrayDeque<>();
        String selection  = "1";
        String complexity = "MODERATE";

        @Override
        public String classify(String prompt) throws ClassifierException {
            prompts.add(prompt);
            if (prompt.startsWith("Pick the dataset")) return selection;
            if (prompt.startsWith("Rate the complexity")) return complexity;
            Object next = codeReplies.poll();
            if (next instanceof ClassifierException e) throw e;
            if (next == null) throw new ClassifierException("no scripted reply");
            return (String) next;
        }

        List<String> generationPrompts() {
            return prompts.stream()
                    .filter(p -> !p.startsWith("Pick the dataset") && !p.startsWith("Rate the complexity"))
                    .toList();
        }
    }
}
