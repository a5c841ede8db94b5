package com.telcomax.assistant.eval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the text report and the raw cell results as JSON, both stamped with the run time.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public record Written(Path report, Path rawResults) {}

    private final Path outputDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    public ReportWriter(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Written write(ComparisonReport report, EvalGrid grid, List<EvalQuery> queries) throws IOException {
        Files.createDirectories(outputDir);
        String stamp = LocalDateTime.now(clock).format(STAMP);

        Path reportPath = outputDir.resolve("comparison_report_" + stamp + ".txt");
        Files.writeString(reportPath, report.render(), StandardCharsets.UTF_8);

        Path rawPath = outputDir.resolve("results_full_" + stamp + ".json");
        mapper.writeValue(rawPath.toFile(), rows(grid, queries));

        log.info("Evaluation report written report={} raw={}", reportPath, rawPath);
        return new Written(reportPath, rawPath);
    }

    static List<Map<String, Object>> rows(EvalGrid grid, List<EvalQuery> queries) {
        Map<String, EvalQuery> byId = new LinkedHashMap<>();
        for (EvalQuery q : queries) {
            byId.put(q.id(), q);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (EvalCell cell : grid.cells()) {
            EvalQuery q = byId.get(cell.key().queryId());
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("chunking", cell.key().chunk().label());
            row.put("retrieval", cell.key().retrieval().label());
            row.put("query_id", cell.key().queryId());
            row.put("query", q == null ? null : q.query());
            row.put("ground_truth", q == null ? null : q.groundTruth());
            row.put("failed", cell.isFailed());
            if (cell.isFailed()) {
                row.put("failure", cell.failure());
            } else {
                row.put("answer", cell.answer());
                row.put("faithfulness", cell.scores().faithfulness());
                row.put("relevancy", cell.scores().relevancy());
                row.put("correctness", cell.scores().correctness());
                row.put("composite", cell.scores().composite());
            }
            rows.add(row);
        }
        return rows;
    }
}
