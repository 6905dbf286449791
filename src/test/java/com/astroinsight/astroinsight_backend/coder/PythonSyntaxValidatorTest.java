package com.astroinsight.astroinsight_backend.coder;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.exception.SandboxUnavailableException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("Python syntax validator")
class PythonSyntaxValidatorTest {

    private static boolean pythonAvailable;

    @BeforeAll
    static void detectInterpreter() {
        try {
            Process p = new ProcessBuilder("python3", "--version").redirectErrorStream(true).start();
            pythonAvailable = p.waitFor(10, TimeUnit.SECONDS) && p.exitValue() == 0;
        } catch (Exception e) {
            pythonAvailable = false;
        }
    }

    private static PythonSyntaxValidator validator(String interpreter) {
        AgentProperties properties = new AgentProperties();
        properties.getExecutor().setInterpreter(interpreter);
        return new PythonSyntaxValidator(properties);
    }

    @Test
    @DisplayName("Valid code parses")
    void validCode() {
        assumeTrue(pythonAvailable, "python3 not installed");

        assertThat(validator("python3").check("import math\nprint(math.pi)\n").valid()).isTrue();
    }

    @Test
    @DisplayName("Invalid code reports the parser message and line")
    void invalidCode() {
        assumeTrue(pythonAvailable, "python3 not installed");

        SyntaxValidator.SyntaxCheck check = validator("python3").check("x = 1\nif x >\n    print(x)\n");

        assertThat(check.valid()).isFalse();
        assertThat(check.message()).startsWith("SyntaxError").contains("line 2");
    }

    @Test
    @DisplayName("Parsing never runs the code")
    void doesNotExecute() {
        assumeTrue(pythonAvailable, "python3 not installed");

        assertThat(validator("python3").check("raise SystemExit(5)\n").valid()).isTrue();
    }

    @Test
    @DisplayName("Blank code is invalid without starting a process")
    void blankCode() {
        assertThat(validator("interpreter-that-does-not-exist").check(" ").message()).isEqualTo("Empty code");
    }

    @Test
    @DisplayName("A missing interpreter raises SandboxUnavailableException")
    void missingInterpreter() {
        assertThatThrownBy(() -> validator("interpreter-that-does-not-exist").check("print(1)"))
                .isInstanceOf(SandboxUnavailableException.class);
    }
}
