package dev.ragflow.backend;

import dev.ragflow.model.Document;

import java.util.List;

/**
 * Searches the private document corpus.
 */
public interface Retriever {

    /**
     * Retrieve documents for a query, most relevant first.
     *
     * @param query      the search query
     * @param nResults   how many candidates to fetch
     * @param rerankTopK how many of those to rerank and keep, or null to skip reranking
     * @return ordered documents, possibly empty
     * @throws CapabilityException if the underlying store fails
     */
    List<Document> retrieve(String query, int nResults, Integer rerankTopK);
}
