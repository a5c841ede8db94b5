package com.telcomax.assistant.eval;

import static org.junit.jupiter.api.Assertions.*;

import com.telcomax.assistant.llm.GenerationException;
import com.telcomax.assistant.rag.Chunk;
import com.telcomax.assistant.rag.ChunkStrategy;
import com.telcomax.assistant.rag.ChunkStrategyFactory;
import com.telcomax.assistant.rag.ChunkStrategyType;
import com.telcomax.assistant.rag.CorpusIngestor;
import com.telcomax.assistant.rag.InMemoryVectorIndex;
import com.telcomax.assistant.rag.SourceDocument;
import com.telcomax.assistant.retrieval.RetrievalStrategyFactory;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import com.telcomax.assistant.retrieval.VectorSearch;
import com.telcomax.assistant.support.FakeGenerationClient;
import com.telcomax.assistant.support.HashingEmbedder;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EvaluationHarnessTest {

  private static final String SCORES = """
      Here is my evaluation:
      {"faithfulness": 0.9, "relevancy": 0.8, "correctness": 0.7}
      """;

  private static final List<SourceDocument> CORPUS = List.of(
      new SourceDocument("invoice_jan", "Billing Period: January 2026.\n\nTotal Amount Due: $137.14."),
      new SourceDocument("invoice_dec", "Billing Period: December 2025.\n\nTotal Amount Due: $122.02."),
      new SourceDocument("plan", "Unlimited Plus, 2 lines, $55.00 per line. Autopay discount of $10.00."));

  private final HashingEmbedder embedder = new HashingEmbedder();
  private final InMemoryVectorIndex index = new InMemoryVectorIndex();
  private final CorpusIngestor ingestor = new CorpusIngestor(embedder, index);
  private final EvaluationSettings settings =
      new EvaluationSettings("eval-", 4, Set.of("telecom-wiki", "customer-docs"));
  private final Retry retry = Retry.of("eval-cell", RetryConfig.custom()
      .maxAttempts(2)
      .waitDuration(Duration.ofMillis(1))
      .build());

  private ExecutorService executor;
  private ChunkStrategyFactory chunkFactory;
  private RetrievalStrategyFactory retrievalFactory;
  private FakeGenerationClient answerClient;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    chunkFactory = new ChunkStrategyFactory(embedder, 400, 75, 0.78);
    retrievalFactory = new RetrievalStrategyFactory(
        new VectorSearch(embedder, index, new SimpleMeterRegistry()),
        FakeGenerationClient.replying("total amount due for the billing period"));
    answerClient = FakeGenerationClient.replying("The total amount due is $137.14.");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private EvaluationHarness harness(FakeGenerationClient judgeClient, ChunkStrategyFactory chunks) {
    return new EvaluationHarness(ingestor, chunks, retrievalFactory, answerClient,
        new AnswerJudge(judgeClient), executor, retry, settings);
  }

  private static List<EvalQuery> queries(int n) {
    return IntStream.rangeClosed(1, n)
        .mapToObj(i -> new EvalQuery(String.format("Q%02d", i), "What is the total amount due " + i + "?",
            "$137.14"))
        .collect(Collectors.toList());
  }

  @Test
  void everyCombinationIsScored() {
    EvalGrid grid = harness(FakeGenerationClient.replying(SCORES), chunkFactory).run(CORPUS, queries(10));

    assertEquals(90, grid.size());
    assertTrue(grid.failed().isEmpty());
    for (ChunkStrategyType chunk : ChunkStrategyType.values()) {
      for (RetrievalStrategyType retrieval : RetrievalStrategyType.values()) {
        List<EvalCell> cells = grid.succeeded(new PairKey(chunk, retrieval));
        assertEquals(10, cells.size(), chunk + "/" + retrieval);
        assertEquals(0.8, cells.get(0).scores().composite(), 1e-9);
      }
    }
  }

  @Test
  void answersAreGeneratedDeterministicallyFromRetrievedContext() {
    harness(FakeGenerationClient.replying(SCORES), chunkFactory).run(CORPUS, queries(1));

    assertEquals(9, answerClient.calls().size());
    for (FakeGenerationClient.Call call : answerClient.calls()) {
      assertEquals(0.0, call.temperature());
      assertEquals(400, call.maxOutputTokens());
      assertTrue(call.system().contains("[invoice_"), call.system());
    }
  }

  @Test
  void eachChunkerGetsItsOwnNamespaceAndProductionIsUntouched() {
    index.upsert("customer-docs", "live__chunk_0", new float[HashingEmbedder.DIMENSIONS], Map.of());

    harness(FakeGenerationClient.replying(SCORES), chunkFactory).run(CORPUS, queries(2));

    assertEquals(1, index.size("customer-docs"));
    for (ChunkStrategyType chunk : ChunkStrategyType.values()) {
      assertTrue(index.size("eval-" + chunk.label()) > 0, chunk.label());
    }
  }

  @Test
  void permanentlyFailingCellIsRecordedAndTheRunContinues() {
    List<EvalQuery> queries = queries(10);
    String poisoned = queries.get(3).query();
    FakeGenerationClient judge = new FakeGenerationClient(call -> {
      if (call.prompt().contains("QUESTION: " + poisoned)) {
        throw new GenerationException("judge unavailable");
      }
      return SCORES;
    });

    EvalGrid grid = harness(judge, chunkFactory).run(CORPUS, queries);

    assertEquals(90, grid.size());
    assertEquals(9, grid.failed().size());
    for (EvalCell cell : grid.failed()) {
      assertEquals("Q04", cell.key().queryId());
      assertTrue(cell.failure().contains("judge unavailable"), cell.failure());
    }
    assertEquals(9, grid.succeeded(new PairKey(ChunkStrategyType.SEMANTIC, RetrievalStrategyType.HYDE)).size());
  }

  @Test
  void transientFailureIsRetried() {
    AtomicBoolean failedOnce = new AtomicBoolean();
    FakeGenerationClient judge = new FakeGenerationClient(call -> {
      if (failedOnce.compareAndSet(false, true)) {
        throw new GenerationException("connection reset");
      }
      return SCORES;
    });

    EvalGrid grid = harness(judge, chunkFactory).run(CORPUS, queries(10));

    assertTrue(grid.failed().isEmpty());
    assertEquals(91, judge.calls().size());
  }

  @Test
  void unusableJudgeOutputFailsTheCell() {
    EvalGrid grid = harness(FakeGenerationClient.replying("Looks good to me!"), chunkFactory)
        .run(CORPUS, queries(1));

    assertEquals(9, grid.failed().size());
    assertTrue(grid.failed().get(0).failure().startsWith("EvaluationException"));
  }

  @Test
  void ingestFailureFailsOnlyThatChunkersCells() {
    ChunkStrategyFactory brokenSemantic = new ChunkStrategyFactory(embedder, 400, 75, 0.78) {
      @Override
      public ChunkStrategy create(ChunkStrategyType type) {
        if (type != ChunkStrategyType.SEMANTIC) {
          return super.create(type);
        }
        return new ChunkStrategy() {
          @Override
          public ChunkStrategyType type() {
            return ChunkStrategyType.SEMANTIC;
          }

          @Override
          public List<Chunk> chunk(SourceDocument document) {
            throw new IllegalStateException("embedding service down");
          }
        };
      }
    };

    EvalGrid grid = harness(FakeGenerationClient.replying(SCORES), brokenSemantic).run(CORPUS, queries(10));

    assertEquals(90, grid.size());
    assertEquals(30, grid.failed().size());
    assertTrue(grid.failed().stream().allMatch(c -> c.key().chunk() == ChunkStrategyType.SEMANTIC));
    assertTrue(grid.failed().get(0).failure().startsWith("ingest failed"));
  }

  @Test
  void namespaceAliasingAProductionNamespaceIsRefused() {
    EvaluationSettings aliasing =
        new EvaluationSettings("customer-", 4, Set.of("telecom-wiki", "Customer_Semantic"));

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> new EvaluationHarness(ingestor, chunkFactory, retrievalFactory, answerClient,
            new AnswerJudge(answerClient), executor, retry, aliasing));
    assertTrue(ex.getMessage().contains("Customer_Semantic"));
  }

  @Test
  void blankPrefixIsRefused() {
    assertThrows(IllegalStateException.class,
        () -> new EvaluationSettings(" ", 4, Set.of("customer-docs")).checkIsolation());
  }

  @Test
  void noQueriesIsAnError() {
    EvaluationHarness harness = harness(FakeGenerationClient.replying(SCORES), chunkFactory);

    assertThrows(IllegalArgumentException.class, () -> harness.run(CORPUS, List.of()));
  }
}
