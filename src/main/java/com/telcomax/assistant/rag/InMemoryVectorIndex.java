package com.telcomax.assistant.rag;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Brute-force cosine index for local runs and tests.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private record Entry(String id, float[] vector, Map<String, String> metadata) {
    }

    private final Map<String, Map<String, Entry>> namespaces = new ConcurrentHashMap<>();

    @Override
    public void upsert(String namespace, String id, float[] vector, Map<String, String> metadata) {
        namespaces.computeIfAbsent(namespace, ns -> new ConcurrentHashMap<>())
                .put(id, new Entry(id, vector.clone(), Map.copyOf(metadata)));
    }

    @Override
    public List<VectorMatch> query(String namespace, float[] vector, int topK) {
        Map<String, Entry> entries = namespaces.getOrDefault(namespace, Map.of());
        return entries.values().stream()
                .map(e -> new VectorMatch(e.id(), VectorMath.cosine(vector, e.vector()), e.metadata()))
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed()
                        .thenComparing(VectorMatch::id))
                .limit(topK)
                .collect(Collectors.toList());
    }

    @Override
    public void deleteNamespace(String namespace) {
        namespaces.remove(namespace);
    }

    public int size(String namespace) {
        return namespaces.getOrDefault(namespace, Map.of()).size();
    }
}
