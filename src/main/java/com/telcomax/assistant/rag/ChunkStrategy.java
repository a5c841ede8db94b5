package com.telcomax.assistant.rag;

import java.util.List;

public interface ChunkStrategy {

    ChunkStrategyType type();

    /**
     * Splits a document into ordered chunks with indexes starting at 0. Blank chunks are never
     * returned.
     */
    List<Chunk> chunk(SourceDocument document);
}
