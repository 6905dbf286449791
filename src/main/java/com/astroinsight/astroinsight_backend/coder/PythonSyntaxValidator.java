package com.astroinsight.astroinsight_backend.coder;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.exception.SandboxUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Parses the code with the interpreter's own {@code ast} module, reading the source from stdin.
 * Nothing is executed: {@code ast.parse} only builds the tree.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PythonSyntaxValidator implements SyntaxValidator {

    private static final String PARSE_SNIPPET =
            "import ast,sys\n"
          + "src=sys.stdin.read()\n"
          + "try:\n"
          + "    ast.parse(src)\n"
          + "except SyntaxError as e:\n"
          + "    print('SyntaxError: %s (line %s)' % (e.msg, e.lineno))\n"
          + "    sys.exit(1)\n";

    private final AgentProperties properties;

    @Override
    public SyntaxCheck check(String code) {
        if (code == null || code.isBlank()) {
            return SyntaxCheck.error("Empty code");
        }
        AgentProperties.Executor cfg = properties.getExecutor();
        Duration timeout = cfg.getSyntaxCheckTimeout();

        Process process;
        try {
            process = new ProcessBuilder(cfg.getInterpreter(), "-c", PARSE_SNIPPET)
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new SandboxUnavailableException(cfg.getInterpreter(), e);
        }

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(code.getBytes(StandardCharsets.UTF_8));
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return SyntaxCheck.error("Syntax check timed out after " + timeout.toSeconds() + " seconds");
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (process.exitValue() == 0) return SyntaxCheck.ok();
            return SyntaxCheck.error(output.isEmpty() ? "Invalid syntax" : output);

        } catch (IOException e) {
            log.warn("Syntax check IO error: {}", e.getMessage());
            return SyntaxCheck.error("Syntax check failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SyntaxCheck.error("Syntax check interrupted");
        } finally {
            if (process.isAlive()) process.destroyForcibly();
        }
    }
}
