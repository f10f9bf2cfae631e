package dev.ragflow.model;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.Locale;
import java.util.Objects;

/**
 * Structured response of the relevance grader.
 */
@JsonClassDescription("Binary score for relevance check on retrieved documents.")
public record RelevanceGrade(
    @JsonProperty("binary_score")
    @JsonPropertyDescription("Documents are relevant to the question, 'yes' or 'no'")
    String binaryScore
) {
    public RelevanceGrade {
        Objects.requireNonNull(binaryScore, "binary_score");
        binaryScore = binaryScore.trim().toLowerCase(Locale.ROOT);
        if (!binaryScore.equals("yes") && !binaryScore.equals("no")) {
            throw new IllegalArgumentException("binary_score must be 'yes' or 'no', got '" + binaryScore + "'");
        }
    }

    public static RelevanceGrade of(boolean relevant) {
        return new RelevanceGrade(relevant ? "yes" : "no");
    }

    public RelevanceVerdict verdict() {
        return binaryScore.equals("yes") ? RelevanceVerdict.RELEVANT : RelevanceVerdict.NOT_RELEVANT;
    }
}
