package com.telcomax.assistant.eval;

import com.telcomax.assistant.rag.ChunkStrategyType;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;

public record PairKey(ChunkStrategyType chunk, RetrievalStrategyType retrieval) {

    public String label() {
        return chunk.label() + " + " + retrieval.label();
    }
}
