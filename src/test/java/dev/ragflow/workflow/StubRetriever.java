package dev.ragflow.workflow;

import dev.ragflow.backend.Retriever;
import dev.ragflow.model.Document;

import java.util.ArrayList;
import java.util.List;

class StubRetriever implements Retriever {

    record Query(String query, int nResults, Integer rerankTopK) {}

    private final List<Document> documents;
    private final List<Query> queries = new ArrayList<>();

    StubRetriever(Document... documents) {
        this.documents = List.of(documents);
    }

    List<Query> queries() {
        return queries;
    }

    @Override
    public List<Document> retrieve(String query, int nResults, Integer rerankTopK) {
        queries.add(new Query(query, nResults, rerankTopK));
        return documents;
    }
}
