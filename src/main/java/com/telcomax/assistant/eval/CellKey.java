package com.telcomax.assistant.eval;

import com.telcomax.assistant.rag.ChunkStrategyType;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;

public record CellKey(ChunkStrategyType chunk, RetrievalStrategyType retrieval, String queryId) {

    public PairKey pair() {
        return new PairKey(chunk, retrieval);
    }

    @Override
    public String toString() {
        return chunk.label() + "/" + retrieval.label() + "/" + queryId;
    }
}
