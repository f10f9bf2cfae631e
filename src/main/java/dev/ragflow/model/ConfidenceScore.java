package dev.ragflow.model;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;
import java.util.Objects;

/**
 * Structured response of the answer evaluator.
 */
@JsonClassDescription("Confidence score for the generated answer.")
public record ConfidenceScore(
    @JsonProperty("confidence")
    @JsonPropertyDescription("Confidence score ranging from 0 to 1")
    double confidence,

    @JsonProperty("missing_info")
    @JsonPropertyDescription("Missing information or context that could improve answer generation")
    List<String> missingInfo,

    @JsonProperty("suggestions")
    @JsonPropertyDescription("Suggestions for improving answer generation")
    List<String> suggestions
) {
    public ConfidenceScore {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        missingInfo = List.copyOf(Objects.requireNonNull(missingInfo, "missing_info"));
        suggestions = List.copyOf(Objects.requireNonNull(suggestions, "suggestions"));
    }

    public ConfidenceAssessment toAssessment() {
        return new ConfidenceAssessment(confidence, missingInfo, suggestions);
    }
}
