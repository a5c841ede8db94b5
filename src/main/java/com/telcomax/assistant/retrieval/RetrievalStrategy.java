package com.telcomax.assistant.retrieval;

import java.util.List;

public interface RetrievalStrategy {

    RetrievalStrategyType type();

    /**
     * @return at most {@code topK} chunks, highest score first
     * @throws RetrievalException when the embedding or vector backend fails
     */
    List<ScoredChunk> retrieve(String query, String namespace, int topK);
}
