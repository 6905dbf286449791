package com.astroinsight.astroinsight_backend.engine;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.exception.SandboxUnavailableException;
import com.astroinsight.astroinsight_backend.model.code.ExecutionResult;
import com.astroinsight.astroinsight_backend.model.code.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs real processes through {@code sh} so the tests do not need Python.
 * The safety screen only looks for Python constructs, so plain shell commands pass it.
 */
@DisplayName("Code executor")
class CodeExecutorTest {

    @TempDir
    Path outputDir;

    private AgentProperties properties;
    private CodeExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getExecutor().setInterpreter("sh");
        properties.getExecutor().setKillGrace(Duration.ofSeconds(1));
        executor = new CodeExecutor(properties, new CodeSafetyChecker());
    }

    @Test
    @DisplayName("Exit 0 is SUCCESS with captured stdout")
    void successfulRun() {
        // When
        ExecutionResult result = executor.execute("echo hello", outputDir, Duration.ofSeconds(10), CancellationToken.none());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.getStdout()).isEqualTo("hello");
        assertThat(result.getExitCode()).isZero();
        assertThat(result.isTruncated()).isFalse();
    }

    @Test
    @DisplayName("Non-zero exit is ERROR carrying stderr")
    void nonZeroExit() {
        // When
        ExecutionResult result = executor.execute("echo broken >&2\nexit 3", outputDir, Duration.ofSeconds(10),
                CancellationToken.none());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(result.getExitCode()).isEqualTo(3);
        assertThat(result.errorMessage()).contains("broken");
    }

    @Test
    @DisplayName("Non-zero exit without stderr reports the exit code")
    void nonZeroExitWithoutStderr() {
        ExecutionResult result = executor.execute("exit 7", outputDir, Duration.ofSeconds(10), CancellationToken.none());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(result.getStderr()).isEqualTo("Process exited with code 7");
    }

    @Test
    @DisplayName("A script running past its deadline is killed and reported as TIMEOUT within a few seconds")
    void timeoutIsContained() {
        // Given
        long started = System.nanoTime();

        // When
        ExecutionResult result = executor.execute("echo started\nsleep 30", outputDir, Duration.ofSeconds(2),
                CancellationToken.none());

        // Then
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(result.getStderr()).contains("timed out after 2 seconds");
        assertThat(result.getStdout()).contains("started");
        assertThat(elapsedMillis).isLessThan(5_000);
    }

    @Test
    @DisplayName("Cancelling the token stops the process and reports ERROR")
    void cancellation() throws Exception {
        // Given
        CancellationToken token = new CancellationToken();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        long started = System.nanoTime();

        // When
        canceller.start();
        ExecutionResult result = executor.execute("sleep 30", outputDir, Duration.ofSeconds(20), token);
        canceller.join();

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(result.getStderr()).contains("cancelled");
        assertThat(Duration.ofNanos(System.nanoTime() - started).toMillis()).isLessThan(5_000);
    }

    @Test
    @DisplayName("Background children of a script that exits cleanly are killed with it")
    void backgroundChildrenDoNotOutliveScript() throws Exception {
        // Given
        String code = """
                ( sleep 2; echo late > late.txt ) > /dev/null 2>&1 &
                sleep 1
                exit 0
                """;

        // When
        ExecutionResult result = executor.execute(code, outputDir, Duration.ofSeconds(10), CancellationToken.none());
        Thread.sleep(3_000);

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(outputDir.resolve("late.txt")).doesNotExist();
    }

    @Test
    @DisplayName("New image and text files in the output directory are reported as artifacts")
    void detectsArtifacts() throws Exception {
        // Given
        Files.writeString(outputDir.resolve("old.png"), "existing");

        // When
        ExecutionResult result = executor.execute(
                "printf 'png' > scatter.png\nprintf 'stats' > summary.txt\nprintf 'x' > ignored.bin",
                outputDir, Duration.ofSeconds(10), CancellationToken.none());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.getGeneratedFiles()).containsExactly(outputDir.resolve("scatter.png").toAbsolutePath().toString());
        assertThat(result.getGeneratedTexts()).containsExactly(outputDir.resolve("summary.txt").toAbsolutePath().toString());
    }

    @Test
    @DisplayName("Output beyond the cap is dropped and marked as truncated")
    void truncatesOutput() {
        // Given
        properties.getExecutor().setMaxOutputBytes(1024);

        // When
        ExecutionResult result = executor.execute(
                "i=0\nwhile [ $i -lt 500 ]; do echo 0123456789; i=$((i+1)); done",
                outputDir, Duration.ofSeconds(10), CancellationToken.none());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getStdout()).endsWith("[output truncated]");
        assertThat(result.getStdout().length()).isLessThan(1100);
    }

    @Test
    @DisplayName("Code failing the safety screen is rejected without spawning a process")
    void rejectsUnsafeCode() {
        // Given
        properties.getExecutor().setInterpreter("interpreter-that-does-not-exist");

        // When
        ExecutionResult result = executor.execute("import subprocess\nsubprocess.run(['ls'])", outputDir,
                Duration.ofSeconds(10), CancellationToken.none());

        // Then
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(result.getStderr()).contains("import subprocess");
        assertThat(result.getExitCode()).isNull();
    }

    @Test
    @DisplayName("A missing interpreter raises SandboxUnavailableException")
    void missingInterpreter() {
        // Given
        properties.getExecutor().setInterpreter("interpreter-that-does-not-exist");

        // When / Then
        assertThatThrownBy(() -> executor.execute("echo hi", outputDir, Duration.ofSeconds(5), CancellationToken.none()))
                .isInstanceOf(SandboxUnavailableException.class)
                .hasMessageContaining("interpreter-that-does-not-exist");
    }
}
