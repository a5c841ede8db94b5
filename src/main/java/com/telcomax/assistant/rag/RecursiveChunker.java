package com.telcomax.assistant.rag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits on the coarsest separator present (paragraph, line, sentence, word, character),
 * recursing into pieces that are still too long, then merges neighbours back up to the size
 * limit with a character overlap.
 */
public class RecursiveChunker implements ChunkStrategy {

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

    private final int maxChars;
    private final int overlapChars;

    public RecursiveChunker(int sizeTokens, int overlapTokens) {
        if (sizeTokens <= 0 || overlapTokens < 0 || overlapTokens >= sizeTokens) {
            throw new IllegalArgumentException("Invalid chunk size/overlap: " + sizeTokens + "/" + overlapTokens);
        }
        this.maxChars = sizeTokens * FixedSizeChunker.CHARS_PER_TOKEN;
        this.overlapChars = overlapTokens * FixedSizeChunker.CHARS_PER_TOKEN;
    }

    @Override
    public ChunkStrategyType type() {
        return ChunkStrategyType.RECURSIVE;
    }

    @Override
    public List<Chunk> chunk(SourceDocument document) {
        List<Chunk> chunks = new ArrayList<>();
        for (String piece : split(document.text(), SEPARATORS)) {
            String text = piece.strip();
            if (!text.isEmpty()) {
                chunks.add(new Chunk(document.docId(), chunks.size(), text));
            }
        }
        return chunks;
    }

    private List<String> split(String text, List<String> separators) {
        String separator = separators.get(separators.size() - 1);
        List<String> finer = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                finer = separators.subList(i + 1, separators.size());
                break;
            }
        }

        List<String> out = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : splitOn(text, separator)) {
            if (piece.length() < maxChars) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                out.addAll(merge(fitting, separator));
                fitting.clear();
            }
            if (finer.isEmpty()) {
                out.add(piece);
            } else {
                out.addAll(split(piece, finer));
            }
        }
        if (!fitting.isEmpty()) {
            out.addAll(merge(fitting, separator));
        }
        return out;
    }

    private static List<String> splitOn(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }
        for (String piece : text.split(Pattern.quote(separator))) {
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
        }
        return pieces;
    }

    private List<String> merge(List<String> pieces, String separator) {
        int separatorLength = separator.length();
        List<String> merged = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;

        for (String piece : pieces) {
            int length = piece.length();
            if (!window.isEmpty() && total + length + separatorLength > maxChars) {
                emit(merged, window, separator);
                while (total > overlapChars
                        || (total > 0 && total + length + (window.isEmpty() ? 0 : separatorLength) > maxChars)) {
                    String dropped = window.removeFirst();
                    total -= dropped.length() + (window.isEmpty() ? 0 : separatorLength);
                }
            }
            total += length + (window.isEmpty() ? 0 : separatorLength);
            window.addLast(piece);
        }
        emit(merged, window, separator);
        return merged;
    }

    private static void emit(List<String> merged, Deque<String> window, String separator) {
        if (window.isEmpty()) {
            return;
        }
        String joined = String.join(separator, window).strip();
        if (!joined.isEmpty()) {
            merged.add(joined);
        }
    }
}
