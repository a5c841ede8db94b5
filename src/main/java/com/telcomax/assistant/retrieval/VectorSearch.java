package com.telcomax.assistant.retrieval;

import com.telcomax.assistant.rag.Embedder;
import com.telcomax.assistant.rag.EmbeddingException;
import com.telcomax.assistant.rag.VectorIndex;
import com.telcomax.assistant.rag.VectorIndexException;
import com.telcomax.assistant.rag.VectorMatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embeds a text and searches one namespace. Shared by all retrieval strategies.
 */
@Component
public class VectorSearch {

    private static final Logger log = LoggerFactory.getLogger(VectorSearch.class);

    private final Embedder embedder;
    private final VectorIndex vectorIndex;
    private final Counter retrievalCounter;
    private final Timer retrievalTimer;

    public VectorSearch(Embedder embedder, VectorIndex vectorIndex, MeterRegistry meterRegistry) {
        this.embedder = embedder;
        this.vectorIndex = vectorIndex;
        this.retrievalCounter = Counter.builder("assistant.retrieval.count")
                .description("Number of vector searches")
                .register(meterRegistry);
        this.retrievalTimer = Timer.builder("assistant.retrieval.duration")
                .description("Embedding plus vector search duration")
                .register(meterRegistry);
    }

    public List<ScoredChunk> search(String text, String namespace, int topK) {
        long startNanos = System.nanoTime();
        List<VectorMatch> matches;
        try {
            matches = vectorIndex.query(namespace, embedder.embed(text), topK);
        } catch (EmbeddingException | VectorIndexException e) {
            throw new RetrievalException("Vector search failed namespace=" + namespace, e);
        } finally {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            retrievalTimer.record(durationMs, TimeUnit.MILLISECONDS);
            retrievalCounter.increment();
        }

        List<ScoredChunk> chunks = matches.stream()
                .map(m -> new ScoredChunk(
                        m.metadata().getOrDefault(VectorIndex.META_DOC_ID, "unknown"),
                        m.metadata().getOrDefault(VectorIndex.META_CHUNK_ID, m.id()),
                        m.metadata().getOrDefault(VectorIndex.META_TEXT, ""),
                        m.score()))
                .collect(Collectors.toList());
        log.debug("Vector search namespace={} hits={} topScore={}", namespace, chunks.size(),
                chunks.isEmpty() ? 0.0 : chunks.get(0).score());
        return chunks;
    }
}
