package com.telcomax.assistant.rag;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ChunkStrategyFactory {

    private final Embedder embedder;
    private final int sizeTokens;
    private final int overlapTokens;
    private final double semanticThreshold;

    public ChunkStrategyFactory(
            Embedder embedder,
            @Value("${app.chunking.size:400}") int sizeTokens,
            @Value("${app.chunking.overlap:75}") int overlapTokens,
            @Value("${app.chunking.semantic-threshold:0.78}") double semanticThreshold) {
        this.embedder = embedder;
        this.sizeTokens = sizeTokens;
        this.overlapTokens = overlapTokens;
        this.semanticThreshold = semanticThreshold;
    }

    public ChunkStrategy create(ChunkStrategyType type) {
        return switch (type) {
            case FIXED_SIZE -> new FixedSizeChunker(sizeTokens, overlapTokens);
            case RECURSIVE -> new RecursiveChunker(sizeTokens, overlapTokens);
            case SEMANTIC -> new SemanticChunker(embedder, sizeTokens, semanticThreshold);
        };
    }
}
