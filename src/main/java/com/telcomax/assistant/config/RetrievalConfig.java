package com.telcomax.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telcomax.assistant.rag.Embedder;
import com.telcomax.assistant.rag.InMemoryVectorIndex;
import com.telcomax.assistant.rag.PgVectorIndex;
import com.telcomax.assistant.rag.SpringAiEmbedder;
import com.telcomax.assistant.rag.VectorIndex;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class RetrievalConfig {

    @Bean
    public Embedder embedder(EmbeddingModel embeddingModel, MeterRegistry meterRegistry) {
        return new SpringAiEmbedder(embeddingModel, meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(name = "app.vector.store", havingValue = "pgvector", matchIfMissing = true)
    public VectorIndex pgVectorIndex(JdbcTemplate jdbcTemplate, ObjectMapper mapper) {
        return new PgVectorIndex(jdbcTemplate, mapper);
    }

    @Bean
    @ConditionalOnProperty(name = "app.vector.store", havingValue = "in-memory")
    public VectorIndex inMemoryVectorIndex() {
        return new InMemoryVectorIndex();
    }

    /**
     * Strategy used when a request names none. Unknown names fail startup.
     */
    @Bean
    public RetrievalStrategyType defaultRetrievalStrategy(
            @Value("${app.retrieval.strategy:direct}") String strategy) {
        try {
            return RetrievalStrategyType.fromLabel(strategy);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid app.retrieval.strategy: " + strategy, e);
        }
    }
}
