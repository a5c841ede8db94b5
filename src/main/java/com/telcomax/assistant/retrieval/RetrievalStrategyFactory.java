package com.telcomax.assistant.retrieval;

import com.telcomax.assistant.llm.GenerationClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Builds the strategy selected for one invocation. Callers receive the {@link RetrievalStrategy}
 * and never branch on its type.
 */
@Component
public class RetrievalStrategyFactory {

    private final VectorSearch vectorSearch;
    private final GenerationClient generationClient;

    public RetrievalStrategyFactory(
            VectorSearch vectorSearch,
            @Qualifier("answerGenerationClient") GenerationClient generationClient) {
        this.vectorSearch = vectorSearch;
        this.generationClient = generationClient;
    }

    public RetrievalStrategy create(RetrievalStrategyType type) {
        return switch (type) {
            case DIRECT -> new DirectRetrieval(vectorSearch);
            case HYDE -> new HypothesisRetrieval(vectorSearch, generationClient);
            case MULTI_QUERY -> new MultiPhrasingRetrieval(vectorSearch, generationClient);
        };
    }

    public RetrievalStrategy create(String label) {
        return create(RetrievalStrategyType.fromLabel(label));
    }
}
