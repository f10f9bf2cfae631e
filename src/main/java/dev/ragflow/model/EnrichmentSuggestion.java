package dev.ragflow.model;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;
import java.util.Objects;

/**
 * Structured response of the knowledge-base enrichment advisor.
 */
@JsonClassDescription("Suggestions for improving document retrieval.")
public record EnrichmentSuggestion(
    @JsonProperty("suggestions")
    @JsonPropertyDescription("Suggestions for documents, books, articles, or related topics to improve retrieval")
    List<String> suggestions,

    @JsonProperty("missing_info")
    @JsonPropertyDescription("Missing information or context that could improve retrieval")
    List<String> missingInfo
) {
    public EnrichmentSuggestion {
        suggestions = List.copyOf(Objects.requireNonNull(suggestions, "suggestions"));
        missingInfo = List.copyOf(Objects.requireNonNull(missingInfo, "missing_info"));
    }
}
