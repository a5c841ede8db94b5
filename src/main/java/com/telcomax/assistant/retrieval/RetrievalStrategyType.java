package com.telcomax.assistant.retrieval;

import java.util.Locale;

public enum RetrievalStrategyType {
    DIRECT("direct"),
    HYDE("hyde"),
    MULTI_QUERY("multi-query");

    private final String label;

    RetrievalStrategyType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts {@code naive} as an alias of {@code direct} and underscores for dashes.
     */
    public static RetrievalStrategyType fromLabel(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("naive")) {
            return DIRECT;
        }
        for (RetrievalStrategyType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "Unknown retrieval strategy: " + raw + " (expected direct, hyde or multi-query)");
    }
}
