package com.telcomax.assistant.agent;

import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.retrieval.ScoredChunk;
import java.util.List;

/**
 * Raw responder output ahead of the guardrail.
 */
public record Draft(
        ResponderType responder,
        Kind kind,
        String text,
        List<ScoredChunk> chunks
) {

    public enum Kind {
        /** Model output, to be checked and parsed. */
        ANSWER,
        /** The responder declined and asks to be replaced. */
        ESCALATION,
        /** Retrieval found nothing. */
        NOT_FOUND,
        /** Retrieval failed. */
        DEGRADED
    }

    public Draft {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static Draft answer(ResponderType responder, String text, List<ScoredChunk> chunks) {
        return new Draft(responder, Kind.ANSWER, text, chunks);
    }

    public static Draft escalation(ResponderType responder, String reason) {
        return new Draft(responder, Kind.ESCALATION, reason, List.of());
    }

    public static Draft notFound(ResponderType responder, String text) {
        return new Draft(responder, Kind.NOT_FOUND, text, List.of());
    }

    public static Draft degraded(ResponderType responder, String text) {
        return new Draft(responder, Kind.DEGRADED, text, List.of());
    }

    public double topScore() {
        return chunks.stream().mapToDouble(ScoredChunk::score).max().orElse(0.0);
    }
}
