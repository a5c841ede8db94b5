package com.telcomax.assistant.rag;

/**
 * A contiguous piece of a {@link SourceDocument}. {@link #id()} is unique within a namespace.
 */
public record Chunk(String docId, int index, String text) {

    public String chunkId() {
        return "chunk_" + index;
    }

    public String id() {
        return docId + "__" + chunkId();
    }
}
