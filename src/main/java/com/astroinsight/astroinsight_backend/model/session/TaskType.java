package com.astroinsight.astroinsight_backend.model.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Professional task categories picked by the task selector.
 * Each maps to exactly one task node.
 */
public enum TaskType {

    CLASSIFICATION("classification", NodeId.CLASSIFICATION),
    RETRIEVAL("retrieval",           NodeId.RETRIEVAL),
    VISUALIZATION("visualization",   NodeId.VISUALIZATION),
    MULTIMARK("multimark",           NodeId.MULTIMARK);

    private final String label;
    private final NodeId node;

    TaskType(String label, NodeId node) {
        this.label = label;
        this.node  = node;
    }

    @JsonValue
    public String getLabel() { return label; }
    public NodeId getNode()  { return node; }

    public static Optional<TaskType> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskType type : values()) {
            if (type.label.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
