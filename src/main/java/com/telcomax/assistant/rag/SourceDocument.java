package com.telcomax.assistant.rag;

public record SourceDocument(String docId, String text) {

    public SourceDocument {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId must not be blank");
        }
        text = text == null ? "" : text;
    }
}
