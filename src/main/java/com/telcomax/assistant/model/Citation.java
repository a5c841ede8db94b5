package com.telcomax.assistant.model;

public record Citation(
        String docId,
        String chunkId,
        String quote,
        double score
) {}
