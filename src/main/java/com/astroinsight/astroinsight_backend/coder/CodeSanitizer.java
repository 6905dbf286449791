package com.astroinsight.astroinsight_backend.coder;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Turns a raw model reply into bare source text. */
public final class CodeSanitizer {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[ \\t]*(?:python|py|python3)?[ \\t]*\\r?\\n(.*?)```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private CodeSanitizer() {}

    /**
     * Strips markdown fences. When the reply wraps code in prose, the first fenced block wins;
     * an unterminated opening fence is dropped on its own.
     */
    public static String clean(String raw) {
        if (raw == null) return "";
        String text = raw.strip();

        Matcher m = FENCED_BLOCK.matcher(text);
        if (m.find()) {
            return m.group(1).strip();
        }

        if (text.startsWith("```")) {
            int newline = text.indexOf('\n');
            text = newline < 0 ? "" : text.substring(newline + 1);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.strip();
    }
}
