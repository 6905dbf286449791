package com.astroinsight.astroinsight_backend.model.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum UserType {

    AMATEUR("amateur"),
    PROFESSIONAL("professional");

    private final String label;

    UserType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }

    /** Exact match on the label, ignoring case and surrounding whitespace. */
    public static Optional<UserType> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (UserType type : values()) {
            if (type.label.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
