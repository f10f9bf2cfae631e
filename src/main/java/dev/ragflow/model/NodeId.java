package dev.ragflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of nodes a workflow graph can be built from.
 */
public enum NodeId {
    RETRIEVE("retrieve"),
    GRADE_DOCUMENTS("grade_documents"),
    GENERATE("generate"),
    WEB_SEARCH("web_search"),
    SUGGEST_ENRICHMENT("suggest_enrichment"),
    CHECK_CONFIDENCE("check_confidence"),
    QUERY_REWRITE("query_rewrite");

    private final String label;

    NodeId(String label) {
        this.label = label;
    }

    /** Lower-case name used in logs, traces, JSON output and routing labels. */
    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
