package com.astroinsight.astroinsight_backend.model.code;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of running one candidate script.
 *
 * Lifecycle: {@link #start} creates it RUNNING, {@link #finish} moves it to a terminal
 * status exactly once. Every field is frozen after that; a second finish throws.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionResult {

    private final Instant startedAt;
    private final String  outputDir;

    private ExecutionStatus status;
    private String          stdout;
    private String          stderr;
    private Integer         exitCode;
    private long            durationMillis;
    private boolean         truncated;
    private List<String>    generatedFiles = List.of();
    private List<String>    generatedTexts = List.of();

    private ExecutionResult(String outputDir, ExecutionStatus status) {
        this.startedAt = Instant.now();
        this.outputDir = outputDir;
        this.status    = status;
    }

    public static ExecutionResult pending(String outputDir) {
        return new ExecutionResult(outputDir, ExecutionStatus.PENDING);
    }

    public static ExecutionResult start(String outputDir) {
        return new ExecutionResult(outputDir, ExecutionStatus.RUNNING);
    }

    /** Finalized ERROR without ever spawning a process (safety check, bad input). */
    public static ExecutionResult rejected(String message) {
        return start(null).finish(ExecutionStatus.ERROR, "", message, null, false, List.of(), List.of());
    }

    public synchronized ExecutionResult markRunning() {
        if (status != ExecutionStatus.PENDING) {
            throw new IllegalStateException("Execution is already " + status);
        }
        status = ExecutionStatus.RUNNING;
        return this;
    }

    public synchronized ExecutionResult finish(ExecutionStatus terminal,
                                               String stdout,
                                               String stderr,
                                               Integer exitCode,
                                               boolean truncated,
                                               List<String> generatedFiles,
                                               List<String> generatedTexts) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution already finalized as " + status);
        }
        this.status         = terminal;
        this.stdout         = stdout != null ? stdout : "";
        this.stderr         = stderr != null ? stderr : "";
        this.exitCode       = exitCode;
        this.truncated      = truncated;
        this.durationMillis = Duration.between(startedAt, Instant.now()).toMillis();
        this.generatedFiles = generatedFiles != null ? List.copyOf(generatedFiles) : List.of();
        this.generatedTexts = generatedTexts != null ? List.copyOf(generatedTexts) : List.of();
        return this;
    }

    // ── Getters ────────────────────────────────────────────────────────────

    public synchronized ExecutionStatus getStatus() { return status; }
    public Instant getStartedAt()                   { return startedAt; }
    public String getOutputDir()                    { return outputDir; }
    public synchronized String getStdout()          { return stdout; }
    public synchronized String getStderr()          { return stderr; }
    public synchronized Integer getExitCode()       { return exitCode; }
    public synchronized long getDurationMillis()    { return durationMillis; }
    public synchronized boolean isTruncated()       { return truncated; }
    public synchronized List<String> getGeneratedFiles() { return generatedFiles; }
    public synchronized List<String> getGeneratedTexts() { return generatedTexts; }

    public boolean isSuccess() {
        return getStatus() == ExecutionStatus.SUCCESS;
    }

    /** Best message to feed into a rewrite prompt: stderr, else stdout, else the status. */
    public synchronized String errorMessage() {
        if (stderr != null && !stderr.isBlank()) return stderr;
        if (stdout != null && !stdout.isBlank()) return stdout;
        return "Execution ended with status " + status;
    }
}
