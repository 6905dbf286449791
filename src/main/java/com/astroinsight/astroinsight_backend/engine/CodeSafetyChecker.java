package com.astroinsight.astroinsight_backend.engine;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static screen applied to generated Python before it is allowed to run.
 *
 * Two rules: no forbidden construct anywhere in the text, and every imported top-level
 * module must be on the allow list. This is a tripwire for obviously unwanted code,
 * not a sandbox; isolation comes from the separate process and its timeout.
 */
@Component
public class CodeSafetyChecker {

    static final List<String> FORBIDDEN_PATTERNS = List.of(
            "import subprocess", "import os.system", "os.system(", "__import__",
            "exec(", "eval(", "input(", "raw_input(", "execfile(", "compile("
    );

    static final Set<String> ALLOWED_IMPORTS = Set.of(
            "pandas", "numpy", "matplotlib", "seaborn", "sklearn", "scipy",
            "astropy", "astroquery", "plotly", "warnings", "os", "sys",
            "pathlib", "json", "csv", "re", "math", "statistics", "datetime",
            "collections", "itertools", "functools", "operator"
    );

    private static final Pattern IMPORT_LINE = Pattern.compile(
            "^\\s*(?:import\\s+([\\w.]+(?:\\s+as\\s+\\w+)?(?:\\s*,\\s*[\\w.]+(?:\\s+as\\s+\\w+)?)*)|from\\s+([\\w.]+)\\s+import\\b)",
            Pattern.MULTILINE);

    public Verdict check(String code) {
        if (code == null || code.isBlank()) {
            return Verdict.unsafe("Empty code");
        }
        for (String pattern : FORBIDDEN_PATTERNS) {
            if (containsForbidden(code, pattern)) {
                return Verdict.unsafe("Forbidden construct: " + pattern);
            }
        }
        Matcher m = IMPORT_LINE.matcher(code);
        while (m.find()) {
            if (m.group(1) != null) {
                for (String part : m.group(1).split(",")) {
                    String module = topLevel(part.trim().split("\\s+")[0]);
                    if (!ALLOWED_IMPORTS.contains(module)) {
                        return Verdict.unsafe("Import not allowed: " + module);
                    }
                }
            } else {
                String module = topLevel(m.group(2));
                if (!ALLOWED_IMPORTS.contains(module)) {
                    return Verdict.unsafe("Import not allowed: " + module);
                }
            }
        }
        return Verdict.SAFE;
    }

    /**
     * Bare builtin calls only: {@code eval(} is forbidden, {@code df.eval(} and
     * {@code re.compile(} are not.
     */
    private static boolean containsForbidden(String code, String pattern) {
        if (!pattern.endsWith("(") || pattern.contains(".")) {
            return code.contains(pattern);
        }
        int from = 0;
        while (true) {
            int idx = code.indexOf(pattern, from);
            if (idx < 0) return false;
            char before = idx == 0 ? ' ' : code.charAt(idx - 1);
            if (before != '.' && before != '_' && !Character.isLetterOrDigit(before)) return true;
            from = idx + 1;
        }
    }

    private static String topLevel(String dotted) {
        int dot = dotted.indexOf('.');
        return dot < 0 ? dotted : dotted.substring(0, dot);
    }

    public record Verdict(boolean safe, String reason) {
        static final Verdict SAFE = new Verdict(true, "");
        static Verdict unsafe(String reason) { return new Verdict(false, reason); }
    }
}
