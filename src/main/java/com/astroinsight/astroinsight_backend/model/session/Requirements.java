package com.astroinsight.astroinsight_backend.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Requirements accumulated over a clarification dialogue.
 * Only ever grows: {@link #merge} is a set union per category.
 */
@Data
public class Requirements {

    private Set<String> datasets      = new LinkedHashSet<>();
    private Set<String> chartTypes    = new LinkedHashSet<>();
    private Set<String> analysisTypes = new LinkedHashSet<>();
    private Set<String> filters       = new LinkedHashSet<>();

    public void merge(Requirements other) {
        if (other == null) return;
        datasets.addAll(other.datasets);
        chartTypes.addAll(other.chartTypes);
        analysisTypes.addAll(other.analysisTypes);
        filters.addAll(other.filters);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return datasets.isEmpty() && chartTypes.isEmpty() && analysisTypes.isEmpty() && filters.isEmpty();
    }

    /** Enough to generate something meaningful: we know what to draw or what to compute. */
    @JsonIgnore
    public boolean isActionable() {
        return !chartTypes.isEmpty() || !analysisTypes.isEmpty();
    }

    /** Human-readable bullet list, empty string when nothing was captured. */
    public String describe() {
        List<String> lines = new ArrayList<>();
        if (!datasets.isEmpty())      lines.add("- datasets: " + String.join(", ", datasets));
        if (!chartTypes.isEmpty())    lines.add("- chart types: " + String.join(", ", chartTypes));
        if (!analysisTypes.isEmpty()) lines.add("- analysis: " + String.join(", ", analysisTypes));
        if (!filters.isEmpty())       lines.add("- filters: " + String.join("; ", filters));
        return String.join("\n", lines);
    }
}
