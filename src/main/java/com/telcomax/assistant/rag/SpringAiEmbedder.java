package com.telcomax.assistant.rag;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.ai.embedding.EmbeddingModel;

public class SpringAiEmbedder implements Embedder {

    private final EmbeddingModel embeddingModel;
    private final Timer embeddingTimer;

    public SpringAiEmbedder(EmbeddingModel embeddingModel, MeterRegistry meterRegistry) {
        this.embeddingModel = embeddingModel;
        this.embeddingTimer = Timer.builder("assistant.embedding.duration")
                .description("Embedding call duration")
                .register(meterRegistry);
    }

    @Override
    public float[] embed(String text) {
        long startNanos = System.nanoTime();
        try {
            return embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding call failed", e);
        } finally {
            embeddingTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }
}
