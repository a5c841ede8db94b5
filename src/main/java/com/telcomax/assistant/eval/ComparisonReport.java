package com.telcomax.assistant.eval;

import com.telcomax.assistant.rag.ChunkStrategyType;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ranked comparison of every (chunk, retrieval) pair. Ranking is by composite score descending,
 * then lower variance across the axis means, then pair label.
 */
public class ComparisonReport {

    static final Comparator<PairSummary> RANKING = Comparator
            .comparingDouble(PairSummary::composite).reversed()
            .thenComparingDouble(PairSummary::variance)
            .thenComparing(s -> s.pair().label());

    private static final int TOP_PAIRS = 3;
    private static final String RULE = "  " + "-".repeat(86);

    private final List<PairSummary> ranked;
    private final List<PairKey> insufficientData;
    private final List<EvalCell> failedCells;
    private final List<EvalQuery> queries;
    private final EvalGrid grid;

    private ComparisonReport(
            List<PairSummary> ranked,
            List<PairKey> insufficientData,
            EvalGrid grid,
            List<EvalQuery> queries) {
        this.ranked = List.copyOf(ranked);
        this.insufficientData = List.copyOf(insufficientData);
        this.failedCells = grid.failed();
        this.queries = List.copyOf(queries);
        this.grid = grid;
    }

    public static ComparisonReport from(EvalGrid grid, List<EvalQuery> queries) {
        List<PairSummary> summaries = new ArrayList<>();
        List<PairKey> insufficient = new ArrayList<>();

        for (ChunkStrategyType chunk : ChunkStrategyType.values()) {
            for (RetrievalStrategyType retrieval : RetrievalStrategyType.values()) {
                PairKey pair = new PairKey(chunk, retrieval);
                List<EvalCell> cells = grid.succeeded(pair);
                if (cells.isEmpty()) {
                    insufficient.add(pair);
                    continue;
                }
                summaries.add(new PairSummary(pair,
                        cells.stream().mapToDouble(c -> c.scores().faithfulness()).average().orElse(0),
                        cells.stream().mapToDouble(c -> c.scores().relevancy()).average().orElse(0),
                        cells.stream().mapToDouble(c -> c.scores().correctness()).average().orElse(0),
                        cells.size()));
            }
        }
        summaries.sort(RANKING);
        return new ComparisonReport(summaries, insufficient, grid, queries);
    }

    public List<PairSummary> ranked() {
        return ranked;
    }

    public Optional<PairSummary> winner() {
        return ranked.stream().findFirst();
    }

    public List<PairKey> insufficientData() {
        return insufficientData;
    }

    public List<EvalCell> failedCells() {
        return failedCells;
    }

    public String render() {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("=".repeat(90));
        lines.add("  RETRIEVAL EVALUATION COMPARISON REPORT");
        lines.add("=".repeat(90));
        lines.add("");
        lines.add("  SUMMARY (mean scores over successful cells, ranked)");
        lines.add(RULE);
        lines.add(fmt("  %-4s %-14s %-13s %13s %11s %13s %11s",
                "#", "Chunking", "Retrieval", "Faithfulness", "Relevancy", "Correctness", "Composite"));
        lines.add(RULE);
        int rank = 1;
        for (PairSummary s : ranked) {
            lines.add(fmt("  %-4d %-14s %-13s %13.3f %11.3f %13.3f %11.3f",
                    rank++, s.pair().chunk().label(), s.pair().retrieval().label(),
                    s.faithfulness(), s.relevancy(), s.correctness(), s.composite()));
        }
        for (PairKey pair : insufficientData) {
            lines.add(fmt("  %-4s %-14s %-13s %s", "-", pair.chunk().label(), pair.retrieval().label(),
                    "insufficient data"));
        }
        lines.add(RULE);
        winner().ifPresent(w -> lines.add(fmt("%n  WINNER: %s (composite: %.3f)", w.pair().label(), w.composite())));

        for (PairSummary s : ranked.subList(0, Math.min(TOP_PAIRS, ranked.size()))) {
            lines.add("");
            lines.add(fmt("  PER-QUERY BREAKDOWN: %s", s.pair().label()));
            lines.add(RULE);
            lines.add(fmt("  %-4s %-50s %6s %6s %6s %7s", "#", "Query", "F", "R", "C", "Avg"));
            for (EvalQuery q : queries) {
                CellKey key = new CellKey(s.pair().chunk(), s.pair().retrieval(), q.id());
                Optional<EvalCell> cell = grid.get(key);
                String query = q.query().length() > 48 ? q.query().substring(0, 45) + "..." : q.query();
                if (cell.isEmpty() || cell.get().isFailed()) {
                    lines.add(fmt("  %-4s %-50s %s", q.id(), query, "FAILED"));
                    continue;
                }
                AxisScores a = cell.get().scores();
                lines.add(fmt("  %-4s %-50s %6.2f %6.2f %6.2f %7.2f",
                        q.id(), query, a.faithfulness(), a.relevancy(), a.correctness(), a.composite()));
            }
        }

        lines.add("");
        lines.add(fmt("  FAILED CELLS (%d, excluded from means)", failedCells.size()));
        lines.add(RULE);
        if (failedCells.isEmpty()) {
            lines.add("  none");
        }
        for (EvalCell cell : failedCells) {
            lines.add(fmt("  %s: %s", cell.key(), cell.failure()));
        }
        lines.add("");
        lines.add("=".repeat(90));
        return String.join("\n", lines);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
