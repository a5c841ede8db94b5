package com.telcomax.assistant.model;

import com.telcomax.assistant.agent.ClassificationException;
import java.util.Locale;

public enum IntentLabel {
    GENERAL_KNOWLEDGE("general_knowledge"),
    ACCOUNT_SPECIFIC("account_specific");

    private final String label;

    IntentLabel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Strict parse of a classifier answer. Surrounding quotes, backticks and a trailing period
     * are tolerated; anything else outside the closed set is rejected.
     */
    public static IntentLabel parse(String raw) {
        if (raw == null) {
            throw new ClassificationException("Classifier returned no label");
        }
        String normalized = raw.trim()
                .replaceAll("^[\"'`]+|[\"'`.]+$", "")
                .trim()
                .toLowerCase(Locale.ROOT);
        for (IntentLabel intent : values()) {
            if (intent.label.equals(normalized)) {
                return intent;
            }
        }
        throw new ClassificationException("Classifier returned out-of-enum label: " + raw);
    }
}
