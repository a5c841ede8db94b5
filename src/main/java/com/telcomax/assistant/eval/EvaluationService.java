package com.telcomax.assistant.eval;

import com.telcomax.assistant.rag.CorpusIngestor;
import com.telcomax.assistant.rag.SourceDocument;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * One benchmark run end to end: load queries and the customer corpus, run the grid, rank and
 * write the report.
 */
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final EvaluationHarness harness;
    private final CorpusIngestor ingestor;
    private final ReportWriter writer;
    private final Resource queriesResource;
    private final String corpusPattern;

    public EvaluationService(
            EvaluationHarness harness,
            CorpusIngestor ingestor,
            ReportWriter writer,
            Resource queriesResource,
            String corpusPattern) {
        this.harness = harness;
        this.ingestor = ingestor;
        this.writer = writer;
        this.queriesResource = queriesResource;
        this.corpusPattern = corpusPattern;
    }

    public ComparisonReport evaluate() throws IOException {
        List<EvalQuery> queries = EvalQueryLoader.load(queriesResource);
        List<SourceDocument> corpus = ingestor.load(corpusPattern);
        if (corpus.isEmpty()) {
            throw new IllegalStateException("No evaluation documents match " + corpusPattern);
        }

        EvalGrid grid = harness.run(corpus, queries);
        ComparisonReport report = ComparisonReport.from(grid, queries);
        writer.write(report, grid, queries);
        report.winner().ifPresent(w ->
                log.info("Evaluation winner pair={} composite={}", w.pair().label(), w.composite()));
        return report;
    }
}
