package com.telcomax.assistant.retrieval;

import com.telcomax.assistant.llm.GenerationClient;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieves for the original query plus up to three generated paraphrases, merging hits by chunk
 * id and keeping each chunk's best score.
 */
public class MultiPhrasingRetrieval implements RetrievalStrategy {

    private static final Logger log = LoggerFactory.getLogger(MultiPhrasingRetrieval.class);

    static final int PHRASINGS = 3;

    static final String PHRASING_SYSTEM_PROMPT =
            "Generate 3 different phrasings of the following user query for a telecom billing "
                    + "system. Return only the 3 queries, one per line, nothing else.";

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s*");

    private final VectorSearch vectorSearch;
    private final GenerationClient generationClient;

    public MultiPhrasingRetrieval(VectorSearch vectorSearch, GenerationClient generationClient) {
        this.vectorSearch = vectorSearch;
        this.generationClient = generationClient;
    }

    @Override
    public RetrievalStrategyType type() {
        return RetrievalStrategyType.MULTI_QUERY;
    }

    @Override
    public List<ScoredChunk> retrieve(String query, String namespace, int topK) {
        String raw = generationClient.complete(PHRASING_SYSTEM_PROMPT, query, 0.5, 200);
        List<String> queries = queries(query, raw);
        log.debug("Multi-phrasing queries={}", queries.size());

        Map<String, ScoredChunk> best = new LinkedHashMap<>();
        for (String q : queries) {
            for (ScoredChunk chunk : vectorSearch.search(q, namespace, topK)) {
                best.merge(chunk.id(), chunk, (a, b) -> b.score() > a.score() ? b : a);
            }
        }

        return best.values().stream()
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(topK)
                .collect(Collectors.toList());
    }

    static List<String> queries(String original, String generated) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        out.add(original);
        seen.add(original.strip().toLowerCase(Locale.ROOT));

        int added = 0;
        for (String line : generated.split("\\R")) {
            String phrasing = LIST_MARKER.matcher(line).replaceFirst("").strip();
            if (phrasing.isEmpty() || !seen.add(phrasing.toLowerCase(Locale.ROOT))) {
                continue;
            }
            out.add(phrasing);
            if (++added == PHRASINGS) {
                break;
            }
        }
        return out;
    }
}
