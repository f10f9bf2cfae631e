package dev.ragflow.model;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured response of the query rewriter.
 */
@JsonClassDescription("Rewritten question for querying external source.")
public record QuestionRewrite(
    @JsonProperty("query")
    @JsonPropertyDescription("Rewritten query based on suggestions and missing information")
    String query
) {
    public QuestionRewrite {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        query = query.strip();
    }
}
