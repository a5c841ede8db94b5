package com.telcomax.assistant.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telcomax.assistant.model.AgentResponse;
import com.telcomax.assistant.model.Citation;
import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.retrieval.ScoredChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strict parser for the account responder's JSON. Confidence and citation scores come from the
 * retrieval results, never from the model.
 *
 * <p>A citation is kept only when its {@code doc_id}/{@code chunk_id} names a retrieved chunk and
 * that chunk's text contains the quote (whitespace-insensitive). Other citations are dropped, so
 * every kept quote is verbatim source text.
 */
public class AgentResponseParser {

    private static final Logger log = LoggerFactory.getLogger(AgentResponseParser.class);

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final Set<String> ALLOWED_FIELDS =
            Set.of("answer", "citations", "confidence_note");
    private static final Set<String> CITATION_FIELDS = Set.of("doc_id", "chunk_id", "quote");

    public static AgentResponse parse(String raw, List<ScoredChunk> chunks, ResponderType responder) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseFormatException("Invalid responder JSON: empty output");
        }
        JsonNode node;
        try {
            node = mapper.readTree(stripFences(raw));
        } catch (Exception e) {
            throw new ResponseFormatException("Invalid responder JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ResponseFormatException("Responder JSON must be an object");
        }

        node.fieldNames().forEachRemaining(name -> {
            if (!ALLOWED_FIELDS.contains(name)) {
                throw new ResponseFormatException("Invalid responder JSON: unknown field " + name);
            }
        });

        JsonNode answerNode = node.get("answer");
        JsonNode citationsNode = node.get("citations");

        if (answerNode == null || !answerNode.isTextual() || answerNode.asText().isBlank()) {
            throw new ResponseFormatException("Invalid responder JSON: answer");
        }
        if (citationsNode == null || !citationsNode.isArray()) {
            throw new ResponseFormatException("Invalid responder JSON: citations");
        }

        List<Citation> citations = new ArrayList<>();
        for (JsonNode c : citationsNode) {
            citation(c, chunks).ifPresent(citations::add);
        }
        if (citations.size() < citationsNode.size()) {
            log.warn("Dropped unverifiable citations kept={} returned={}", citations.size(), citationsNode.size());
        }

        double confidence = chunks.stream().mapToDouble(ScoredChunk::score).max().orElse(0.0);
        return new AgentResponse(answerNode.asText().strip(), citations, confidence, responder);
    }

    private static Optional<Citation> citation(JsonNode c, List<ScoredChunk> chunks) {
        if (!c.isObject()) {
            throw new ResponseFormatException("Invalid responder JSON: citation must be an object");
        }
        c.fieldNames().forEachRemaining(name -> {
            if (!CITATION_FIELDS.contains(name)) {
                throw new ResponseFormatException("Invalid responder JSON: unknown citation field " + name);
            }
        });

        JsonNode docId = c.get("doc_id");
        JsonNode chunkId = c.get("chunk_id");
        JsonNode quote = c.get("quote");
        if (docId == null || !docId.isTextual() || docId.asText().isBlank()) {
            throw new ResponseFormatException("Invalid responder JSON: citation doc_id");
        }
        if (chunkId == null || !(chunkId.isTextual() || chunkId.isIntegralNumber())
                || chunkId.asText().isBlank()) {
            throw new ResponseFormatException("Invalid responder JSON: citation chunk_id");
        }
        if (quote == null || !quote.isTextual() || quote.asText().isBlank()) {
            throw new ResponseFormatException("Invalid responder JSON: citation quote");
        }

        String doc = docId.asText().strip();
        String normalizedChunkId = normalizeChunkId(chunkId.asText().strip());
        String quoted = quote.asText().strip();
        Optional<ScoredChunk> source = chunks.stream()
                .filter(ch -> ch.docId().equals(doc) && ch.chunkId().equals(normalizedChunkId))
                .findFirst();
        if (source.isEmpty()) {
            log.debug("Citation names no retrieved chunk docId={} chunkId={}", doc, normalizedChunkId);
            return Optional.empty();
        }
        if (!collapseWhitespace(source.get().text()).contains(collapseWhitespace(quoted))) {
            log.debug("Citation quote not found in chunk docId={} chunkId={}", doc, normalizedChunkId);
            return Optional.empty();
        }
        return Optional.of(new Citation(doc, normalizedChunkId, quoted, source.get().score()));
    }

    private static String collapseWhitespace(String text) {
        return text == null ? "" : text.strip().replaceAll("\\s+", " ");
    }

    static String normalizeChunkId(String chunkId) {
        return chunkId.chars().allMatch(Character::isDigit) ? "chunk_" + chunkId : chunkId;
    }

    private static String stripFences(String raw) {
        String text = raw.strip();
        if (text.startsWith("```json")) {
            text = text.substring(7);
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.strip();
    }
}
