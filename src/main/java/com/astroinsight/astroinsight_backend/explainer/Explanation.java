package com.astroinsight.astroinsight_backend.explainer;

import java.util.List;

/** Plain-language reading of a finished analysis: one summary paragraph and a few key insights. */
public record Explanation(String summary, List<String> insights) {

    public Explanation {
        insights = insights != null ? List.copyOf(insights) : List.of();
    }

    /** Text block appended to the visualization answer. */
    public String render() {
        StringBuilder sb = new StringBuilder("Summary:\n").append(summary);
        if (!insights.isEmpty()) {
            sb.append("\n\nKey insights:");
            insights.forEach(i -> sb.append("\n- ").append(i));
        }
        return sb.toString();
    }
}
