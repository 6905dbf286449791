package com.astroinsight.astroinsight_backend.coder;

import com.astroinsight.astroinsight_backend.model.code.Complexity;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;

/** Prompt text for the code synthesis loop. Wording only; no control flow depends on it. */
public final class CodePrompts {

    private CodePrompts() {}

    public static String datasetSelection(String summary, String request) {
        return """
                Pick the dataset that best fits the user's request.

                %s
                User request: %s

                If the request names a dataset, pick that one.
                Reply with the dataset number only (starting at 1).
                """.formatted(summary, request);
    }

    public static String complexity(String request) {
        return """
                Rate the complexity of this data analysis request.

                Request: %s

                SIMPLE   - look at the data, basic statistics, one simple plot
                MODERATE - filtering, grouping, a few plots, correlations
                COMPLEX  - modelling, machine learning, multi-step pipelines

                Reply with exactly one word: SIMPLE, MODERATE or COMPLEX.
                """.formatted(request);
    }

    public static String generation(DatasetInfo dataset, String request, Complexity complexity) {
        return """
                You write complete, directly runnable Python 3 analysis scripts.

                ## Dataset
                - name: %s
                - path: %s
                - columns: %s

                ## Request
                %s

                ## Scope
                %s

                ## Rules
                - Load the dataset from the exact path above with pandas.
                - Save every figure and text result into the current working directory
                  (relative file names, e.g. plt.savefig("scatter.png")); never call plt.show().
                - Print a short summary of the results to stdout.
                - Allowed libraries: pandas, numpy, matplotlib, seaborn, scipy, sklearn, astropy, plotly
                  and the standard library. Do not use subprocess, eval, exec or input.
                - Do not wrap the script in functions or an if __name__ == "__main__" block.
                - ASCII punctuation only.

                Output only the Python code, no explanations.
                """.formatted(dataset.name(), dataset.path(), DatasetCatalog.abbreviate(dataset.columns(), 20),
                request, scope(complexity));
    }

    public static String rewrite(String request, String failedCode, String errorMessage,
                                 DatasetInfo dataset, int attempt, int maxAttempts) {
        return """
                The previous script failed. Rewrite it from scratch so that it satisfies the request.
                This is attempt %d of %d.

                ## Request
                %s

                ## Dataset
                - name: %s
                - path: %s
                - columns: %s

                ## Failed code
                ```python
                %s
                ```

                ## Error
                %s

                ## Rules
                - Fix the cause of the error above; check column names against the dataset columns.
                - Keep the logic simple and direct, guard file access.
                - Save outputs into the current working directory; never call plt.show().
                - ASCII punctuation only; no functions wrapping the whole script.

                Output only the complete Python code, no explanations.
                """.formatted(attempt, maxAttempts, request, dataset.name(), dataset.path(),
                DatasetCatalog.abbreviate(dataset.columns(), 20), failedCode, errorMessage);
    }

    private static String scope(Complexity complexity) {
        return switch (complexity) {
            case SIMPLE   -> "Keep it minimal: load, inspect, at most one plot.";
            case MODERATE -> "Clean the data where needed, compute the requested statistics, produce clear plots.";
            case COMPLEX  -> "Structure the work in clear steps, handle missing values, explain results in printed output.";
        };
    }
}
