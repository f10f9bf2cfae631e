package dev.ragflow.model;

import java.util.List;

/**
 * Partial update returned by a node. A null field means "leave unchanged";
 * a non-null field overwrites the current value. {@code question} is always
 * replaced as a whole.
 */
public record StateUpdate(
    String question,
    List<Document> documents,
    RelevanceVerdict relevance,
    String answer,
    Double confidence,
    List<String> suggestions,
    List<String> missingInfo
) {
    private static final StateUpdate EMPTY = new StateUpdate(null, null, null, null, null, null, null);

    public StateUpdate {
        documents = documents == null ? null : List.copyOf(documents);
        suggestions = suggestions == null ? null : List.copyOf(suggestions);
        missingInfo = missingInfo == null ? null : List.copyOf(missingInfo);
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public static StateUpdate ofQuestion(String question) {
        return EMPTY.withQuestion(question);
    }

    public static StateUpdate ofDocuments(List<Document> documents) {
        return EMPTY.withDocuments(documents);
    }

    public static StateUpdate ofRelevance(RelevanceVerdict relevance) {
        return EMPTY.withRelevance(relevance);
    }

    public static StateUpdate ofAnswer(String answer) {
        return EMPTY.withAnswer(answer);
    }

    /** Sets confidence, suggestions and missing info from one assessment. */
    public static StateUpdate ofAssessment(ConfidenceAssessment assessment) {
        return EMPTY.withAssessment(assessment);
    }

    public StateUpdate withQuestion(String question) {
        return new StateUpdate(question, documents, relevance, answer, confidence, suggestions, missingInfo);
    }

    public StateUpdate withDocuments(List<Document> documents) {
        return new StateUpdate(question, documents, relevance, answer, confidence, suggestions, missingInfo);
    }

    public StateUpdate withRelevance(RelevanceVerdict relevance) {
        return new StateUpdate(question, documents, relevance, answer, confidence, suggestions, missingInfo);
    }

    public StateUpdate withAnswer(String answer) {
        return new StateUpdate(question, documents, relevance, answer, confidence, suggestions, missingInfo);
    }

    public StateUpdate withAssessment(ConfidenceAssessment assessment) {
        return new StateUpdate(question, documents, relevance, answer,
            assessment.score(), assessment.suggestions(), assessment.missingInfo());
    }
}
