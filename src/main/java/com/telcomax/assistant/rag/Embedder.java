package com.telcomax.assistant.rag;

public interface Embedder {

    /**
     * @throws EmbeddingException when the embedding backend is unavailable
     */
    float[] embed(String text);
}
