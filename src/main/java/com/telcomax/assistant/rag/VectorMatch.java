package com.telcomax.assistant.rag;

import java.util.Map;

/**
 * One hit from {@link VectorIndex#query}. Score is cosine similarity clamped to [0,1].
 */
public record VectorMatch(String id, double score, Map<String, String> metadata) {

    public VectorMatch {
        score = Math.max(0.0, Math.min(1.0, score));
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
