package dev.ragflow.backend;

import java.util.List;

/**
 * External web search.
 */
public interface WebSearcher {

    /**
     * @return text snippets in the provider's ranking order, possibly empty
     * @throws CapabilityException if the search call fails
     */
    List<String> search(String query);
}
