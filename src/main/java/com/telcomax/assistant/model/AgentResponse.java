package com.telcomax.assistant.model;

import java.util.List;

public record AgentResponse(
        String answer,
        List<Citation> citations,
        double confidence,
        ResponderType responder
) {

    public AgentResponse {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
