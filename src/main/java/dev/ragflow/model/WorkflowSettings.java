package dev.ragflow.model;

import java.util.Objects;

/**
 * Tunables shared by every workflow variant.
 *
 * @param nResults                  how many documents the retriever is asked for
 * @param rerankTopK                rerank depth passed to the retriever, nullable to skip reranking
 * @param confidenceThreshold       an assessment strictly above this ends the search loop
 * @param suggestionConfidenceCheck whether the suggestion workflow scores its answer before ending
 * @param guardrails                execution limits enforced by the graph executor
 */
public record WorkflowSettings(
    int nResults,
    Integer rerankTopK,
    double confidenceThreshold,
    boolean suggestionConfidenceCheck,
    Guardrails guardrails
) {
    public static final int DEFAULT_N_RESULTS = 5;
    public static final int DEFAULT_RERANK_TOP_K = 3;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.9;

    public WorkflowSettings {
        if (nResults < 1) {
            throw new IllegalArgumentException("nResults must be positive: " + nResults);
        }
        if (rerankTopK != null && rerankTopK < 1) {
            throw new IllegalArgumentException("rerankTopK must be positive: " + rerankTopK);
        }
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]: " + confidenceThreshold);
        }
        Objects.requireNonNull(guardrails, "guardrails");
    }

    public static WorkflowSettings defaults() {
        return new WorkflowSettings(DEFAULT_N_RESULTS, DEFAULT_RERANK_TOP_K,
            DEFAULT_CONFIDENCE_THRESHOLD, false, Guardrails.defaults());
    }

    public WorkflowSettings withGuardrails(Guardrails guardrails) {
        return new WorkflowSettings(nResults, rerankTopK, confidenceThreshold, suggestionConfidenceCheck, guardrails);
    }
}
