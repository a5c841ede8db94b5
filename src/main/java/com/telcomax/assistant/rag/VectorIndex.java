package com.telcomax.assistant.rag;

import java.util.List;
import java.util.Map;

/**
 * Namespaced vector storage. Implementations translate backend failures into
 * {@link VectorIndexException}.
 */
public interface VectorIndex {

    String META_DOC_ID = "doc_id";
    String META_CHUNK_ID = "chunk_id";
    String META_TEXT = "text";

    void upsert(String namespace, String id, float[] vector, Map<String, String> metadata);

    /**
     * @return up to {@code topK} matches, highest score first
     */
    List<VectorMatch> query(String namespace, float[] vector, int topK);

    void deleteNamespace(String namespace);
}
