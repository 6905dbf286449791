package com.astroinsight.astroinsight_backend.handler;

import com.astroinsight.astroinsight_backend.model.session.UserType;

import java.util.List;

/** Classifier prompts of the routing and answering nodes. */
public final class NodePrompts {

    private NodePrompts() {}

    public static String identity(String input) {
        return """
                Decide which kind of user wrote this astronomy message.

                amateur      - general or popular-science questions, concepts, "how big", "why does it shine"
                professional - classification of objects, data retrieval, plotting, data analysis, image annotation

                Message: %s

                Reply with exactly one word: amateur or professional.
                """.formatted(input);
    }

    public static String qa(String input, UserType userType) {
        String audience = userType == UserType.PROFESSIONAL
                ? "a professional astronomer; be precise and technical"
                : "an interested amateur; be clear and accurate without jargon";
        return """
                You are an astronomy assistant answering %s.

                Question: %s

                Answer in a few short paragraphs.
                """.formatted(audience, input);
    }

    public static String taskSelection(String input) {
        return """
                Pick the task that matches this professional astronomy request.

                classification - identify what type of object something is ("what type is M31", "classify NGC 224")
                retrieval      - look up catalog data or survey records for an object or region
                visualization  - analyse a dataset and produce plots or statistics
                multimark      - annotate astronomical images or train image models

                Request: %s

                Reply with exactly one word: classification, retrieval, visualization or multimark.
                """.formatted(input);
    }

    public static String classification(String input, String objectName, List<String> categories) {
        return """
                Classify the astronomical object in this request.

                Request: %s
                Object: %s

                Allowed categories: %s

                Reply with exactly one category from the list.
                """.formatted(input, objectName, String.join(", ", categories));
    }

    public static String retrieval(String input) {
        return """
                Draft a data retrieval answer for this request. Name the catalogs or surveys
                (for example SIMBAD, SDSS, Gaia) that hold the data, the fields that answer it,
                and an example ADQL query where one applies.

                Request: %s
                """.formatted(input);
    }

    public static String annotationPlan(String input, boolean training) {
        return """
                Draft a short plan for this astronomical %s request: data needed, steps, expected output.

                Request: %s
                """.formatted(training ? "model training" : "image annotation", input);
    }
}
