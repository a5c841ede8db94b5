package com.telcomax.assistant.eval;

import static org.junit.jupiter.api.Assertions.*;

import com.telcomax.assistant.rag.ChunkStrategyType;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ComparisonReportTest {

  private static final List<EvalQuery> QUERIES = List.of(
      new EvalQuery("Q01", "What is the January 2026 total?", "$137.14"),
      new EvalQuery("Q02", "What plan am I on?", "Unlimited Plus"));

  private EvalGrid grid;

  @BeforeEach
  void setUp() {
    grid = new EvalGrid();
  }

  private void score(ChunkStrategyType chunk, RetrievalStrategyType retrieval, String queryId,
      double f, double r, double c) {
    grid.put(EvalCell.succeeded(new CellKey(chunk, retrieval, queryId), new AxisScores(f, r, c), "answer"));
  }

  private void fail(ChunkStrategyType chunk, RetrievalStrategyType retrieval, String queryId) {
    grid.put(EvalCell.failed(new CellKey(chunk, retrieval, queryId), "GenerationException: timeout"));
  }

  @Test
  void pairsRankByCompositeThenVarianceThenLabel() {
    score(ChunkStrategyType.FIXED_SIZE, RetrievalStrategyType.DIRECT, "Q01", 1.0, 1.0, 0.25);
    score(ChunkStrategyType.FIXED_SIZE, RetrievalStrategyType.HYDE, "Q01", 0.75, 0.5, 0.25);
    score(ChunkStrategyType.SEMANTIC, RetrievalStrategyType.DIRECT, "Q01", 0.5, 0.5, 0.5);
    score(ChunkStrategyType.RECURSIVE, RetrievalStrategyType.DIRECT, "Q01", 0.5, 0.5, 0.5);

    ComparisonReport report = ComparisonReport.from(grid, QUERIES);

    List<String> order = report.ranked().stream().map(s -> s.pair().label()).toList();
    assertEquals(List.of(
        "fixed_size + direct",
        "recursive + direct",
        "semantic + direct",
        "fixed_size + hyde"), order);
    assertEquals("fixed_size + direct", report.winner().orElseThrow().pair().label());
    assertEquals(0.75, report.winner().orElseThrow().composite(), 1e-9);
  }

  @Test
  void failedCellsAreExcludedFromMeansAndListed() {
    score(ChunkStrategyType.FIXED_SIZE, RetrievalStrategyType.MULTI_QUERY, "Q01", 0.25, 0.25, 0.25);
    fail(ChunkStrategyType.FIXED_SIZE, RetrievalStrategyType.MULTI_QUERY, "Q02");

    ComparisonReport report = ComparisonReport.from(grid, QUERIES);

    PairSummary summary = report.ranked().get(0);
    assertEquals(1, summary.cells());
    assertEquals(0.25, summary.composite(), 1e-9);
    assertEquals(1, report.failedCells().size());
    assertEquals(8, report.insufficientData().size());

    String rendered = report.render();
    assertTrue(rendered.contains("FAILED CELLS (1, excluded from means)"));
    assertTrue(rendered.contains("fixed_size/multi-query/Q02: GenerationException: timeout"));
    assertTrue(rendered.contains("WINNER: fixed_size + multi-query (composite: 0.250)"));
  }

  @Test
  void pairsWithoutSuccessfulCellsAreMarkedInsufficient() {
    fail(ChunkStrategyType.SEMANTIC, RetrievalStrategyType.HYDE, "Q01");
    score(ChunkStrategyType.RECURSIVE, RetrievalStrategyType.HYDE, "Q01", 0.5, 0.5, 0.5);

    ComparisonReport report = ComparisonReport.from(grid, QUERIES);

    assertTrue(report.insufficientData().contains(
        new PairKey(ChunkStrategyType.SEMANTIC, RetrievalStrategyType.HYDE)));
    assertEquals(1, report.ranked().size());
    assertTrue(report.render().contains("insufficient data"));
  }

  @Test
  void perQueryBreakdownShowsFailedQueries() {
    score(ChunkStrategyType.RECURSIVE, RetrievalStrategyType.DIRECT, "Q01", 1.0, 1.0, 1.0);
    fail(ChunkStrategyType.RECURSIVE, RetrievalStrategyType.DIRECT, "Q02");

    String rendered = ComparisonReport.from(grid, QUERIES).render();

    assertTrue(rendered.contains("PER-QUERY BREAKDOWN: recursive + direct"));
    assertTrue(rendered.contains("What plan am I on?"));
    assertTrue(rendered.contains("FAILED"));
  }

  @Test
  void allCellsFailedMeansNoWinner() {
    fail(ChunkStrategyType.FIXED_SIZE, RetrievalStrategyType.DIRECT, "Q01");

    ComparisonReport report = ComparisonReport.from(grid, QUERIES);

    assertTrue(report.winner().isEmpty());
    assertEquals(9, report.insufficientData().size());
    assertFalse(report.render().contains("WINNER"));
  }

  @Test
  void cellIsRecordedOnlyOnce() {
    score(ChunkStrategyType.FIXED_SIZE, RetrievalStrategyType.DIRECT, "Q01", 1.0, 1.0, 1.0);

    assertThrows(IllegalStateException.class,
        () -> fail(ChunkStrategyType.FIXED_SIZE, RetrievalStrategyType.DIRECT, "Q01"));
  }

  @Test
  void axisScoresAreClamped() {
    AxisScores scores = new AxisScores(1.4, -0.2, Double.NaN);

    assertEquals(1.0, scores.faithfulness());
    assertEquals(0.0, scores.relevancy());
    assertEquals(0.0, scores.correctness());
  }
}
