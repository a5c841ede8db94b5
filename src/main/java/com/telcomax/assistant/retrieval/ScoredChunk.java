package com.telcomax.assistant.retrieval;

import java.util.List;
import java.util.stream.Collectors;

public record ScoredChunk(String docId, String chunkId, String text, double score) {

    public String id() {
        return docId + "__" + chunkId;
    }

    /**
     * Renders chunks as {@code [doc_id] text} blocks for a generation prompt.
     */
    public static String formatContext(List<ScoredChunk> chunks) {
        return chunks.stream()
                .filter(c -> c.text() != null && !c.text().isBlank())
                .map(c -> "[" + c.docId() + "] " + c.text())
                .collect(Collectors.joining("\n\n---\n\n"));
    }
}
