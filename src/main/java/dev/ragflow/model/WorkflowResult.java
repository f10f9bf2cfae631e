package dev.ragflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Final aggregate returned to the caller once a workflow run terminates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowResult(
    String workflow,
    String question,
    String answer,
    Double confidence, // nullable, no assessment was made
    List<String> suggestions,
    List<String> missingInfo,
    List<Document> documents,
    List<NodeId> path,
    ExitStatus exitStatus,
    String exitReason,
    int stepCount
) {
    public WorkflowResult {
        suggestions = List.copyOf(suggestions);
        missingInfo = List.copyOf(missingInfo);
        documents = List.copyOf(documents);
        path = List.copyOf(path);
    }

    public boolean completed() {
        return exitStatus == ExitStatus.COMPLETED;
    }
}
