package com.telcomax.assistant.retrieval;

import com.telcomax.assistant.llm.GenerationClient;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches with the embedding of a short generated answer instead of the question itself.
 */
public class HypothesisRetrieval implements RetrievalStrategy {

    private static final Logger log = LoggerFactory.getLogger(HypothesisRetrieval.class);

    static final String HYPOTHESIS_SYSTEM_PROMPT =
            "You are a telecom billing expert. Write a concise hypothetical answer to the "
                    + "following question. Maximum 3 sentences.";

    private final VectorSearch vectorSearch;
    private final GenerationClient generationClient;

    public HypothesisRetrieval(VectorSearch vectorSearch, GenerationClient generationClient) {
        this.vectorSearch = vectorSearch;
        this.generationClient = generationClient;
    }

    @Override
    public RetrievalStrategyType type() {
        return RetrievalStrategyType.HYDE;
    }

    @Override
    public List<ScoredChunk> retrieve(String query, String namespace, int topK) {
        String hypothesis = generationClient.complete(HYPOTHESIS_SYSTEM_PROMPT, query, 0.3, 200).strip();
        log.debug("Hypothesis generated chars={}", hypothesis.length());
        return vectorSearch.search(hypothesis, namespace, topK);
    }
}
