package com.astroinsight.astroinsight_backend.dialogue;

import com.astroinsight.astroinsight_backend.model.session.Requirements;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword extraction of analysis requirements from one user message.
 * Matching is case-insensitive; each category maps a canonical name to its trigger words.
 */
final class RequirementExtractor {

    private static final Map<String, List<String>> CHART_TYPES = new LinkedHashMap<>();
    private static final Map<String, List<String>> ANALYSIS_TYPES = new LinkedHashMap<>();

    static {
        CHART_TYPES.put("scatter",   List.of("scatter", "散点图"));
        CHART_TYPES.put("histogram", List.of("histogram", "hist", "直方图"));
        CHART_TYPES.put("heatmap",   List.of("heatmap", "heat map", "热力图"));
        CHART_TYPES.put("line",      List.of("line chart", "line plot", "line", "折线图"));
        CHART_TYPES.put("bar",       List.of("bar chart", "bar", "柱状图"));
        CHART_TYPES.put("box",       List.of("boxplot", "box plot", "box", "箱线图"));
        CHART_TYPES.put("pie",       List.of("pie", "饼图"));

        ANALYSIS_TYPES.put("correlation",  List.of("correlation", "correlate", "相关"));
        ANALYSIS_TYPES.put("distribution", List.of("distribution", "分布"));
        ANALYSIS_TYPES.put("outlier",      List.of("outlier", "anomaly", "异常"));
        ANALYSIS_TYPES.put("trend",        List.of("trend", "趋势"));
        ANALYSIS_TYPES.put("statistics",   List.of("statistics", "statistic", "summary", "统计"));
    }

    // A filter phrase runs to the end of its clause
    private static final Pattern FILTER = Pattern.compile(
            "\\b(?:greater than|less than|between|where|filter)\\b[^,;\\n，。；]*"
          + "|(?:大于|小于|筛选|过滤)[^,;\\n，。；]*"
          + "|[A-Za-z_][\\w.]*\\s*[<>]=?\\s*-?\\d+(?:\\.\\d+)?",
            Pattern.CASE_INSENSITIVE);

    private RequirementExtractor() {}

    static Requirements extract(String text, Collection<String> datasetNames) {
        Requirements found = new Requirements();
        if (text == null || text.isBlank()) return found;
        String lower = text.toLowerCase(Locale.ROOT);

        for (String name : datasetNames) {
            if (!name.isBlank() && lower.contains(name.toLowerCase(Locale.ROOT))) {
                found.getDatasets().add(name);
            }
        }
        collect(lower, CHART_TYPES, found.getChartTypes());
        collect(lower, ANALYSIS_TYPES, found.getAnalysisTypes());

        Matcher m = FILTER.matcher(text);
        while (m.find()) {
            String phrase = m.group().strip().replaceAll("\\.$", "");
            if (!phrase.isEmpty()) found.getFilters().add(phrase);
        }
        return found;
    }

    private static void collect(String lower, Map<String, List<String>> vocabulary, Collection<String> into) {
        vocabulary.forEach((canonical, triggers) -> {
            for (String trigger : triggers) {
                if (containsWord(lower, trigger)) {
                    into.add(canonical);
                    return;
                }
            }
        });
    }

    /** Word-bounded for Latin triggers so "line" does not match "baseline"; plain substring otherwise. */
    static boolean containsWord(String lower, String trigger) {
        if (!trigger.chars().allMatch(c -> c < 128)) {
            return lower.contains(trigger);
        }
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(trigger) + "(?![a-z0-9])").matcher(lower).find();
    }
}
