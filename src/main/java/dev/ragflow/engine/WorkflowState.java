package dev.ragflow.engine;

import dev.ragflow.model.ConfidenceAssessment;
import dev.ragflow.model.Document;
import dev.ragflow.model.NodeId;
import dev.ragflow.model.RelevanceVerdict;
import dev.ragflow.model.StateUpdate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable state for one workflow execution. Nodes read it; only the executor writes it.
 */
public final class WorkflowState {
    private String question;
    private List<Document> documents;
    private RelevanceVerdict relevance;
    private String answer;
    private Double confidence;
    private List<String> suggestions;
    private List<String> missingInfo;

    private NodeId currentNode;
    private int stepCount;
    private final Map<NodeId, Integer> nodeVisitCounts;
    private final List<NodeId> path;

    private WorkflowState(String question) {
        this.question = Objects.requireNonNull(question, "question");
        this.documents = List.of();
        this.suggestions = List.of();
        this.missingInfo = List.of();
        this.stepCount = 0;
        this.nodeVisitCounts = new EnumMap<>(NodeId.class);
        this.path = new ArrayList<>();
    }

    /**
     * Fresh state holding only the question.
     */
    public static WorkflowState initial(String question) {
        return new WorkflowState(question);
    }

    public String question() { return question; }
    public List<Document> documents() { return documents; }
    public RelevanceVerdict relevance() { return relevance; }
    public String answer() { return answer; }
    public Double confidence() { return confidence; }
    public List<String> suggestions() { return suggestions; }
    public List<String> missingInfo() { return missingInfo; }

    public NodeId currentNode() { return currentNode; }
    public int stepCount() { return stepCount; }
    public List<NodeId> path() { return Collections.unmodifiableList(path); }

    public int visitCount(NodeId node) {
        return nodeVisitCounts.getOrDefault(node, 0);
    }

    /**
     * The last confidence assessment, or null if no node has scored the answer yet.
     */
    public ConfidenceAssessment assessment() {
        return confidence == null ? null : new ConfidenceAssessment(confidence, missingInfo, suggestions);
    }

    /**
     * Merge a node's partial update: present fields overwrite, absent fields are kept.
     */
    void apply(StateUpdate update) {
        if (update.question() != null) {
            this.question = update.question();
        }
        if (update.documents() != null) {
            this.documents = update.documents();
        }
        if (update.relevance() != null) {
            this.relevance = update.relevance();
        }
        if (update.answer() != null) {
            this.answer = update.answer();
        }
        if (update.confidence() != null) {
            this.confidence = update.confidence();
        }
        if (update.suggestions() != null) {
            this.suggestions = update.suggestions();
        }
        if (update.missingInfo() != null) {
            this.missingInfo = update.missingInfo();
        }
    }

    /**
     * Enter a node: update currentNode, increment stepCount, record the visit.
     */
    void enter(NodeId node) {
        this.currentNode = node;
        this.stepCount++;
        this.nodeVisitCounts.merge(node, 1, Integer::sum);
        this.path.add(node);
    }
}
