package com.telcomax.assistant.model;

import com.telcomax.assistant.agent.TurnState;
import java.util.List;

public record TurnResult(
        String sessionId,
        TurnState state,
        IntentLabel intent,
        ResponderType responder,
        String response,
        List<Citation> citations,
        List<String> rejectionReasons,
        List<String> trace
) {

    public boolean approved() {
        return state == TurnState.APPROVED;
    }
}
