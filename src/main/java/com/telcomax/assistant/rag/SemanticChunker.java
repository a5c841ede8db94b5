package com.telcomax.assistant.rag;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Groups consecutive sentences while their embeddings stay similar. A similarity drop below the
 * threshold starts a new chunk, as does exceeding the token budget.
 */
public class SemanticChunker implements ChunkStrategy {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.78;

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n\\s*\\n|\\n");

    private final Embedder embedder;
    private final int sizeTokens;
    private final double similarityThreshold;

    public SemanticChunker(Embedder embedder, int sizeTokens, double similarityThreshold) {
        this.embedder = embedder;
        this.sizeTokens = sizeTokens;
        this.similarityThreshold = similarityThreshold;
    }

    @Override
    public ChunkStrategyType type() {
        return ChunkStrategyType.SEMANTIC;
    }

    @Override
    public List<Chunk> chunk(SourceDocument document) {
        List<String> sentences = sentences(document.text());
        if (sentences.isEmpty()) {
            return List.of();
        }
        if (sentences.size() == 1) {
            return List.of(new Chunk(document.docId(), 0, document.text().strip()));
        }

        List<float[]> vectors = new ArrayList<>(sentences.size());
        for (String sentence : sentences) {
            vectors.add(embedder.embed(sentence));
        }

        List<Chunk> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        current.add(sentences.get(0));

        for (int i = 1; i < sentences.size(); i++) {
            double similarity = VectorMath.cosine(vectors.get(i - 1), vectors.get(i));
            if (similarity < similarityThreshold) {
                flush(document, chunks, current);
                current.add(sentences.get(i));
                continue;
            }
            current.add(sentences.get(i));
            if (String.join(" ", current).length() / FixedSizeChunker.CHARS_PER_TOKEN > sizeTokens) {
                flush(document, chunks, current);
            }
        }
        flush(document, chunks, current);
        return chunks;
    }

    private static void flush(SourceDocument document, List<Chunk> chunks, List<String> sentences) {
        String text = String.join(" ", sentences).strip();
        if (!text.isEmpty()) {
            chunks.add(new Chunk(document.docId(), chunks.size(), text));
        }
        sentences.clear();
    }

    static List<String> sentences(String text) {
        List<String> out = new ArrayList<>();
        for (String raw : SENTENCE_BREAK.split(text)) {
            String sentence = raw.strip();
            if (!sentence.isEmpty()) {
                out.add(sentence);
            }
        }
        return out;
    }
}
