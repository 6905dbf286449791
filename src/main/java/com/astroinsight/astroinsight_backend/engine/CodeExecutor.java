package com.astroinsight.astroinsight_backend.engine;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.exception.SandboxUnavailableException;
import com.astroinsight.astroinsight_backend.model.code.ExecutionResult;
import com.astroinsight.astroinsight_backend.model.code.ExecutionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Runs one generated script in its own OS process and produces exactly one {@link ExecutionResult}.
 *
 * How it works:
 *   1. Screen the code with {@link CodeSafetyChecker}; a rejection never spawns anything
 *   2. Snapshot the output directory, write the script to a temp file outside it
 *   3. Start the interpreter with the output directory as working directory
 *   4. Drain stdout and stderr concurrently into capped buffers
 *   5. Wait until exit, deadline or cancellation; kill the process and every child seen while it ran
 *   6. Scan the output directory for new or modified artifacts
 *
 * The process is killed and reaped and the script deleted on every exit path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeExecutor {

    private static final long   POLL_MILLIS       = 50;
    private static final int    SCAN_DEPTH        = 3;
    private static final String TRUNCATION_MARKER = "\n...[output truncated]";

    static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".svg", ".pdf");
    static final Set<String> TEXT_EXTENSIONS  = Set.of(".txt", ".log", ".md", ".json", ".csv");

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final AgentProperties   properties;
    private final CodeSafetyChecker safetyChecker;

    // ── Public API ────────────────────────────────────────────────────────────

    /** Runs in a fresh temporary output directory with no cancellation. */
    public ExecutionResult execute(String code, Duration timeout) {
        Path outputDir;
        try {
            outputDir = Files.createTempDirectory("ai_exec_");
        } catch (IOException e) {
            log.error("Cannot create temporary output directory: {}", e.getMessage());
            return ExecutionResult.rejected("Cannot create output directory: " + e.getMessage());
        }
        return execute(code, outputDir, timeout, CancellationToken.none());
    }

    /**
     * @param outputDir working directory of the script; created if missing, never cleaned
     * @param timeout   wall-clock budget, the configured default when null
     * @param token     checked while waiting; cancelling kills the process
     * @throws SandboxUnavailableException when the interpreter cannot be started
     */
    public ExecutionResult execute(String code, Path outputDir, Duration timeout, CancellationToken token) {
        CodeSafetyChecker.Verdict verdict = safetyChecker.check(code);
        if (!verdict.safe()) {
            log.warn("Code rejected before execution: {}", verdict.reason());
            return ExecutionResult.rejected("Rejected by safety check: " + verdict.reason());
        }

        AgentProperties.Executor cfg = properties.getExecutor();
        Duration budget = timeout != null ? timeout : cfg.getTimeout();
        CancellationToken cancel = token != null ? token : CancellationToken.none();

        ExecutionResult result = ExecutionResult.pending(outputDir.toAbsolutePath().toString());
        Path scriptFile = null;
        Process process = null;
        StreamCollector stdout = null;
        StreamCollector stderr = null;
        Set<ProcessHandle> children = new HashSet<>();

        try {
            Files.createDirectories(outputDir);
            Map<Path, FileTime> before = snapshot(outputDir);

            scriptFile = Files.createTempFile("ai_script_", ".py");
            Files.writeString(scriptFile, code, StandardCharsets.UTF_8);

            ProcessBuilder builder = new ProcessBuilder(cfg.getInterpreter(), scriptFile.toAbsolutePath().toString())
                    .directory(outputDir.toFile());
            builder.environment().put("OUTPUT_DIR", outputDir.toAbsolutePath().toString());
            builder.environment().put("MPLBACKEND", "Agg");

            try {
                process = builder.start();
            } catch (IOException e) {
                throw new SandboxUnavailableException(cfg.getInterpreter(), e);
            }
            result.markRunning();

            stdout = StreamCollector.start(process.getInputStream(), cfg.getMaxOutputBytes(), "stdout");
            stderr = StreamCollector.start(process.getErrorStream(), cfg.getMaxOutputBytes(), "stderr");

            Outcome outcome = awaitExit(process, budget, cancel, children);
            // Also after a clean exit: a background child would outlive the script
            killTree(process, children, cfg.getKillGrace());
            long graceMillis = cfg.getKillGrace().toMillis();
            stdout.join(graceMillis);
            stderr.join(graceMillis);

            List<String> images = new ArrayList<>();
            List<String> texts  = new ArrayList<>();
            scanArtifacts(outputDir, before, images, texts);

            boolean truncated = stdout.isTruncated() || stderr.isTruncated();
            if (truncated) {
                log.warn("Execution output truncated at {} bytes per stream", cfg.getMaxOutputBytes());
            }

            return switch (outcome) {
                case TIMED_OUT -> {
                    log.warn("Execution timed out after {} s in {}", budget.toSeconds(), outputDir);
                    yield result.finish(ExecutionStatus.TIMEOUT, stdout.text(),
                            appendLine(stderr.text(), "Execution timed out after " + budget.toSeconds() + " seconds."),
                            null, truncated, images, texts);
                }
                case CANCELLED -> result.finish(ExecutionStatus.ERROR, stdout.text(),
                        appendLine(stderr.text(), "Execution cancelled."), null, truncated, images, texts);
                case EXITED -> {
                    int exit = process.exitValue();
                    if (exit == 0) {
                        yield result.finish(ExecutionStatus.SUCCESS, stdout.text(), stderr.text(), exit, truncated, images, texts);
                    }
                    String err = stderr.text().isBlank() ? "Process exited with code " + exit : stderr.text();
                    yield result.finish(ExecutionStatus.ERROR, stdout.text(), err, exit, truncated, images, texts);
                }
            };

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finishQuietly(result, "Execution was interrupted.", stdout, stderr);
        } catch (IOException e) {
            log.error("CodeExecutor IO error: {}", e.getMessage());
            return finishQuietly(result, "Failed to run script: " + e.getMessage(), stdout, stderr);
        } finally {
            if (process != null && process.isAlive()) {
                killTree(process, children, cfg.getKillGrace());
            }
            deleteSilently(scriptFile);
        }
    }

    // ── Process control ───────────────────────────────────────────────────────

    private enum Outcome { EXITED, TIMED_OUT, CANCELLED }

    /** Records every descendant seen on each poll into {@code children}. */
    private Outcome awaitExit(Process process, Duration budget, CancellationToken token,
                              Set<ProcessHandle> children) throws InterruptedException {
        long deadline = System.nanoTime() + budget.toNanos();
        while (true) {
            process.descendants().forEach(children::add);
            if (token.isCancelled()) return Outcome.CANCELLED;
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) return Outcome.TIMED_OUT;
            if (process.waitFor(Math.min(POLL_MILLIS, remainingMillis), TimeUnit.MILLISECONDS)) {
                return Outcome.EXITED;
            }
        }
    }

    /**
     * Children first. Once the parent dies they are reparented and no longer reachable from it,
     * so the ones recorded while it ran are killed too.
     */
    private void killTree(Process process, Set<ProcessHandle> children, Duration grace) {
        process.descendants().forEach(children::add);
        children.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        if (process.isAlive()) {
            process.destroyForcibly();
        }
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process {} not reaped within {} ms", process.pid(), grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionResult finishQuietly(ExecutionResult result, String message,
                                          StreamCollector stdout, StreamCollector stderr) {
        if (result.getStatus().isTerminal()) return result;
        String out = stdout != null ? stdout.text() : "";
        String err = stderr != null ? appendLine(stderr.text(), message) : message;
        if (result.getStatus() == ExecutionStatus.PENDING) result.markRunning();
        return result.finish(ExecutionStatus.ERROR, out, err, null, false, List.of(), List.of());
    }

    // ── Artifacts ─────────────────────────────────────────────────────────────

    private Map<Path, FileTime> snapshot(Path dir) throws IOException {
        Map<Path, FileTime> files = new HashMap<>();
        try (Stream<Path> walk = Files.walk(dir, SCAN_DEPTH)) {
            walk.filter(Files::isRegularFile).forEach(p -> files.put(p, lastModified(p)));
        }
        return files;
    }

    private void scanArtifacts(Path dir, Map<Path, FileTime> before, List<String> images, List<String> texts) throws IOException {
        try (Stream<Path> walk = Files.walk(dir, SCAN_DEPTH)) {
            walk.filter(Files::isRegularFile)
                .filter(p -> !before.containsKey(p) || !lastModified(p).equals(before.get(p)))
                .sorted()
                .forEach(p -> {
                    String ext = extension(p);
                    if (IMAGE_EXTENSIONS.contains(ext))     images.add(p.toAbsolutePath().toString());
                    else if (TEXT_EXTENSIONS.contains(ext)) texts.add(p.toAbsolutePath().toString());
                });
        }
    }

    private static FileTime lastModified(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static String extension(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String appendLine(String text, String line) {
        return text == null || text.isBlank() ? line : text + "\n" + line;
    }

    private void deleteSilently(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }

    /** Drains one process stream on its own thread, keeping at most {@code cap} bytes. */
    static final class StreamCollector {

        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final int    cap;
        private final Thread thread;
        private boolean      truncated;

        private StreamCollector(InputStream in, int cap, String name) {
            this.cap    = cap;
            this.thread = new Thread(() -> drain(in), "exec-" + name + "-" + THREAD_SEQ.incrementAndGet());
            this.thread.setDaemon(true);
        }

        static StreamCollector start(InputStream in, int cap, String name) {
            StreamCollector collector = new StreamCollector(in, cap, name);
            collector.thread.start();
            return collector;
        }

        private void drain(InputStream in) {
            byte[] chunk = new byte[8192];
            try (in) {
                int n;
                while ((n = in.read(chunk)) != -1) {
                    append(chunk, n);
                }
            } catch (IOException e) {
                // stream closed under us when the process was killed
                log.debug("{} closed: {}", Thread.currentThread().getName(), e.getMessage());
            }
        }

        private synchronized void append(byte[] chunk, int n) {
            int room = cap - buffer.size();
            if (room <= 0) {
                truncated = true;
                return;
            }
            int take = Math.min(room, n);
            buffer.write(chunk, 0, take);
            if (take < n) truncated = true;
        }

        void join(long millis) throws InterruptedException {
            thread.join(Math.max(1, millis));
        }

        synchronized boolean isTruncated() {
            return truncated;
        }

        synchronized String text() {
            String s = buffer.toString(StandardCharsets.UTF_8).trim();
            return truncated ? s + TRUNCATION_MARKER : s;
        }
    }
}
