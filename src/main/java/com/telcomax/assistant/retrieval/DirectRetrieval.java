package com.telcomax.assistant.retrieval;

import java.util.List;

public class DirectRetrieval implements RetrievalStrategy {

    private final VectorSearch vectorSearch;

    public DirectRetrieval(VectorSearch vectorSearch) {
        this.vectorSearch = vectorSearch;
    }

    @Override
    public RetrievalStrategyType type() {
        return RetrievalStrategyType.DIRECT;
    }

    @Override
    public List<ScoredChunk> retrieve(String query, String namespace, int topK) {
        return vectorSearch.search(query, namespace, topK);
    }
}
