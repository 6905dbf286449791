package com.astroinsight.astroinsight_backend.model.code;

import java.util.Locale;

/** Shapes the generation prompt only; the loop never branches on it. */
public enum Complexity {
    SIMPLE,
    MODERATE,
    COMPLEX;

    /**
     * Parses a classifier reply. Accepts the bare label anywhere in the text;
     * anything unrecognisable is MODERATE.
     */
    public static Complexity parse(String raw) {
        if (raw == null || raw.isBlank()) return MODERATE;
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Complexity c : values()) {
            if (normalized.equals(c.name())) return c;
        }
        Complexity found = null;
        for (Complexity c : values()) {
            if (normalized.contains(c.name())) {
                if (found != null) return MODERATE;  // ambiguous
                found = c;
            }
        }
        return found != null ? found : MODERATE;
    }
}
