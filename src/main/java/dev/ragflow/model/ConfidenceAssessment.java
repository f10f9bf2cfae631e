package dev.ragflow.model;

import java.util.List;

/**
 * A model-judged score for an answer plus what would make it better.
 */
public record ConfidenceAssessment(
    double score,
    List<String> missingInfo,
    List<String> suggestions
) {
    public ConfidenceAssessment {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Confidence score must be within [0, 1]: " + score);
        }
        missingInfo = missingInfo == null ? List.of() : List.copyOf(missingInfo);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
