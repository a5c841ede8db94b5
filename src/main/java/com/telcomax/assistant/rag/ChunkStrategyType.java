package com.telcomax.assistant.rag;

import java.util.Arrays;
import java.util.Locale;

public enum ChunkStrategyType {
    FIXED_SIZE("fixed_size"),
    RECURSIVE("recursive"),
    SEMANTIC("semantic");

    private final String label;

    ChunkStrategyType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ChunkStrategyType fromLabel(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown chunk strategy: " + raw));
    }
}
