package com.telcomax.assistant.agent;

import com.telcomax.assistant.memory.Session;
import com.telcomax.assistant.retrieval.RetrievalStrategy;

/**
 * Everything a responder needs for one draft. {@code strict} asks for a stricter output format
 * after a malformed first attempt.
 */
public record ResponderContext(
        Session session,
        String query,
        RetrievalStrategy retrieval,
        int topK,
        boolean strict
) {

    public ResponderContext strictAttempt() {
        return new ResponderContext(session, query, retrieval, topK, true);
    }
}
