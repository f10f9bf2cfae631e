package dev.ragflow.workflow;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The workflow variants, selectable by name.
 */
public enum WorkflowType {
    BASIC("basic-rag", "Retrieve and answer, no grading"),
    SUGGESTION("suggestion-rag", "Grade retrieval, suggest knowledge-base enrichment when nothing is relevant"),
    SEARCH("search-rag", "Grade retrieval, fall back to web search, rewrite and re-search until confident");

    public static final WorkflowType DEFAULT = SUGGESTION;

    private final String id;
    private final String description;

    WorkflowType(String id, String description) {
        this.id = id;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    /**
     * Look up a workflow by id; null or blank selects {@link #DEFAULT}.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static WorkflowType fromId(String id) {
        if (id == null || id.isBlank()) {
            return DEFAULT;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (WorkflowType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown workflow '%s'. Valid workflows: %s".formatted(id,
            Arrays.stream(values()).map(WorkflowType::id).collect(Collectors.joining(", "))));
    }

    public boolean needsWebSearch() {
        return this == SEARCH;
    }
}
