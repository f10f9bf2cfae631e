package dev.ragflow.backend;

/**
 * Secondary relevance model used to reorder retrieval candidates. Higher scores are better.
 */
@FunctionalInterface
public interface Reranker {

    double score(String query, String content);
}
