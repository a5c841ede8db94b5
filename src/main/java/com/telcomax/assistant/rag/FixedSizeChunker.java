package com.telcomax.assistant.rag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Accumulates whole paragraphs up to a token budget (about 4 characters per token). When a
 * paragraph would overflow, the current chunk is emitted and the next one starts with the last
 * {@code overlap / 4} words of it.
 */
public class FixedSizeChunker implements ChunkStrategy {

    static final int CHARS_PER_TOKEN = 4;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int sizeTokens;
    private final int overlapTokens;

    public FixedSizeChunker(int sizeTokens, int overlapTokens) {
        if (sizeTokens <= 0 || overlapTokens < 0) {
            throw new IllegalArgumentException("Invalid chunk size/overlap: " + sizeTokens + "/" + overlapTokens);
        }
        this.sizeTokens = sizeTokens;
        this.overlapTokens = overlapTokens;
    }

    @Override
    public ChunkStrategyType type() {
        return ChunkStrategyType.FIXED_SIZE;
    }

    @Override
    public List<Chunk> chunk(SourceDocument document) {
        List<Chunk> chunks = new ArrayList<>();
        String current = "";

        for (String raw : PARAGRAPH_BREAK.split(document.text())) {
            String paragraph = raw.strip();
            if (paragraph.isEmpty()) {
                continue;
            }

            String combined = current.isEmpty() ? paragraph : current + "\n\n" + paragraph;
            if (combined.length() / CHARS_PER_TOKEN <= sizeTokens) {
                current = combined;
                continue;
            }

            if (!current.isEmpty()) {
                chunks.add(new Chunk(document.docId(), chunks.size(), current.strip()));
            }
            if (!current.isEmpty() && overlapTokens > 0) {
                current = overlapTail(current) + "\n\n" + paragraph;
            } else {
                current = paragraph;
            }
        }

        if (!current.isBlank()) {
            chunks.add(new Chunk(document.docId(), chunks.size(), current.strip()));
        }
        return chunks;
    }

    private String overlapTail(String text) {
        String[] words = WHITESPACE.split(text.strip());
        int overlapWords = overlapTokens / CHARS_PER_TOKEN;
        if (overlapWords == 0 || words.length <= overlapWords) {
            return "";
        }
        return String.join(" ", Arrays.copyOfRange(words, words.length - overlapWords, words.length));
    }
}
