package com.telcomax.assistant.eval;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.core.io.Resource;

/**
 * Reads {@code query | ground truth} lines. Blank lines and lines starting with {@code #} are
 * skipped; queries are numbered Q01, Q02, ... in file order.
 */
public final class EvalQueryLoader {

    private EvalQueryLoader() {
    }

    public static List<EvalQuery> load(Resource resource) throws IOException {
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static List<EvalQuery> parse(Reader source) throws IOException {
        List<EvalQuery> queries = new ArrayList<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int bar = line.indexOf('|');
            String query = (bar < 0 ? line : line.substring(0, bar)).strip();
            String truth = bar < 0 ? "" : line.substring(bar + 1).strip();
            if (query.isEmpty()) {
                continue;
            }
            queries.add(new EvalQuery(String.format(Locale.ROOT, "Q%02d", queries.size() + 1), query, truth));
        }
        return queries;
    }
}
