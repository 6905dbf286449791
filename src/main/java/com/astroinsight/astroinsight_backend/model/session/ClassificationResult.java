package com.astroinsight.astroinsight_backend.model.session;

/**
 * @param objectName catalog designation found in the request, or "Unknown"
 * @param category   one of the allowed categories, "unknown" when the label was rejected
 * @param rawLabel   the classifier's reply before validation
 */
public record ClassificationResult(String objectName, String category, String rawLabel) {}
