package com.telcomax.assistant.eval;

import com.telcomax.assistant.llm.GenerationClient;
import com.telcomax.assistant.rag.ChunkStrategy;
import com.telcomax.assistant.rag.ChunkStrategyFactory;
import com.telcomax.assistant.rag.ChunkStrategyType;
import com.telcomax.assistant.rag.CorpusIngestor;
import com.telcomax.assistant.rag.SourceDocument;
import com.telcomax.assistant.retrieval.RetrievalStrategy;
import com.telcomax.assistant.retrieval.RetrievalStrategyFactory;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import com.telcomax.assistant.retrieval.ScoredChunk;
import io.github.resilience4j.retry.Retry;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every (chunk strategy, retrieval strategy, query) cell. Each chunk strategy gets its own
 * freshly ingested namespace; cells then run in parallel on the supplied executor, each retried
 * independently. A cell that still fails is recorded as failed and the run continues.
 */
public class EvaluationHarness {

    private static final Logger log = LoggerFactory.getLogger(EvaluationHarness.class);

    static final String NO_CONTEXT_ANSWER =
            "I could not find relevant information to answer this question.";

    private static final String ANSWER_SYSTEM_PROMPT = """
            You are a telecom billing assistant. Answer the user's question using ONLY the provided
            context. Be concise and factual. If the context doesn't have enough information, say so.

            Context:
            %s
            """;

    private final CorpusIngestor ingestor;
    private final ChunkStrategyFactory chunkStrategies;
    private final RetrievalStrategyFactory retrievalStrategies;
    private final GenerationClient answerClient;
    private final AnswerJudge judge;
    private final Executor executor;
    private final Retry cellRetry;
    private final EvaluationSettings settings;

    public EvaluationHarness(
            CorpusIngestor ingestor,
            ChunkStrategyFactory chunkStrategies,
            RetrievalStrategyFactory retrievalStrategies,
            GenerationClient answerClient,
            AnswerJudge judge,
            Executor executor,
            Retry cellRetry,
            EvaluationSettings settings) {
        settings.checkIsolation();
        this.ingestor = ingestor;
        this.chunkStrategies = chunkStrategies;
        this.retrievalStrategies = retrievalStrategies;
        this.answerClient = answerClient;
        this.judge = judge;
        this.executor = executor;
        this.cellRetry = cellRetry;
        this.settings = settings;
    }

    public EvalGrid run(List<SourceDocument> corpus, List<EvalQuery> queries) {
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("No evaluation queries");
        }
        EvalGrid grid = new EvalGrid();
        log.info("Evaluation started chunkers={} retrievers={} queries={} cells={}",
                ChunkStrategyType.values().length, RetrievalStrategyType.values().length, queries.size(),
                ChunkStrategyType.values().length * RetrievalStrategyType.values().length * queries.size());

        Set<ChunkStrategyType> ingested = ingestAll(corpus, queries, grid);

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (ChunkStrategyType chunk : ingested) {
            String namespace = settings.namespace(chunk);
            for (RetrievalStrategyType retrievalType : RetrievalStrategyType.values()) {
                RetrievalStrategy retrieval = retrievalStrategies.create(retrievalType);
                for (EvalQuery query : queries) {
                    CellKey key = new CellKey(chunk, retrievalType, query.id());
                    futures.add(CompletableFuture.runAsync(
                            () -> grid.put(runCell(key, query, namespace, retrieval)), executor));
                }
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        log.info("Evaluation finished cells={} failed={}", grid.size(), grid.failed().size());
        return grid;
    }

    private Set<ChunkStrategyType> ingestAll(List<SourceDocument> corpus, List<EvalQuery> queries, EvalGrid grid) {
        Set<ChunkStrategyType> ingested = EnumSet.noneOf(ChunkStrategyType.class);
        for (ChunkStrategyType chunk : ChunkStrategyType.values()) {
            String namespace = settings.namespace(chunk);
            ChunkStrategy chunker = chunkStrategies.create(chunk);
            try {
                int count = ingestor.reingest(corpus, namespace, chunker);
                log.info("Evaluation corpus ingested chunker={} namespace={} chunks={}",
                        chunk.label(), namespace, count);
                ingested.add(chunk);
            } catch (RuntimeException e) {
                log.warn("Evaluation ingest failed chunker={} namespace={}", chunk.label(), namespace, e);
                for (RetrievalStrategyType retrievalType : RetrievalStrategyType.values()) {
                    for (EvalQuery query : queries) {
                        grid.put(EvalCell.failed(new CellKey(chunk, retrievalType, query.id()),
                                "ingest failed: " + e.getMessage()));
                    }
                }
            }
        }
        return ingested;
    }

    private EvalCell runCell(CellKey key, EvalQuery query, String namespace, RetrievalStrategy retrieval) {
        long startNanos = System.nanoTime();
        try {
            EvalCell cell = cellRetry.executeSupplier(() -> attempt(key, query, namespace, retrieval));
            log.info("Cell scored cell={} composite={} durationMs={}", key,
                    String.format(Locale.ROOT, "%.2f", cell.scores().composite()), (System.nanoTime() - startNanos) / 1_000_000);
            return cell;
        } catch (RuntimeException e) {
            log.warn("Cell failed cell={} reason={}", key, e.getMessage());
            return EvalCell.failed(key, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private EvalCell attempt(CellKey key, EvalQuery query, String namespace, RetrievalStrategy retrieval) {
        List<ScoredChunk> chunks = retrieval.retrieve(query.query(), namespace, settings.topK());
        String context = ScoredChunk.formatContext(chunks);

        String answer = context.isEmpty()
                ? NO_CONTEXT_ANSWER
                : answerClient.complete(ANSWER_SYSTEM_PROMPT.formatted(context), query.query(), 0.0, 400).strip();

        List<String> contexts = chunks.stream()
                .map(ScoredChunk::text)
                .filter(t -> t != null && !t.isBlank())
                .collect(Collectors.toList());
        AxisScores scores = judge.score(query.query(), answer, contexts, query.groundTruth());
        return EvalCell.succeeded(key, scores, answer);
    }
}
