package com.telcomax.assistant.eval;

import com.telcomax.assistant.rag.ChunkStrategyType;
import java.util.Locale;
import java.util.Set;

/**
 * @param namespacePrefix prefix of the per-chunker evaluation namespaces, e.g. {@code eval-}
 * @param productionNamespaces namespaces served to customers; never written by an evaluation run
 */
public record EvaluationSettings(String namespacePrefix, int topK, Set<String> productionNamespaces) {

    public EvaluationSettings {
        productionNamespaces = Set.copyOf(productionNamespaces);
    }

    public String namespace(ChunkStrategyType chunk) {
        return namespacePrefix + chunk.label();
    }

    /**
     * @throws IllegalStateException when any evaluation namespace equals or aliases a production
     *     namespace (comparison ignores case, surrounding blanks and {@code _}/{@code -})
     */
    public void checkIsolation() {
        if (namespacePrefix == null || namespacePrefix.isBlank()) {
            throw new IllegalStateException("app.eval.namespace-prefix must not be blank");
        }
        if (topK <= 0) {
            throw new IllegalStateException("Evaluation top-k must be positive: " + topK);
        }
        for (ChunkStrategyType chunk : ChunkStrategyType.values()) {
            String candidate = canonical(namespace(chunk));
            for (String production : productionNamespaces) {
                if (candidate.equals(canonical(production))) {
                    throw new IllegalStateException("Evaluation namespace " + namespace(chunk)
                            + " aliases production namespace " + production);
                }
            }
        }
    }

    private static String canonical(String namespace) {
        return namespace.strip().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
