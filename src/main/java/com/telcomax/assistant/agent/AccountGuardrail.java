package com.telcomax.assistant.agent;

import com.telcomax.assistant.memory.Session;
import com.telcomax.assistant.model.AgentResponse;
import com.telcomax.assistant.model.ResponderType;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AccountGuardrail implements Guardrail {

    private static final Logger log = LoggerFactory.getLogger(AccountGuardrail.class);

    @Override
    public ResponderType responder() {
        return ResponderType.ACCOUNT_SPECIFIC;
    }

    @Override
    public GuardrailVerdict check(Draft draft, Session session) {
        switch (draft.kind()) {
            case NOT_FOUND:
            case DEGRADED:
                // no citations; the validator turns these into a clarifying question
                return GuardrailVerdict.pass(
                        new AgentResponse(draft.text(), List.of(), 0.0, ResponderType.ACCOUNT_SPECIFIC));
            case ESCALATION:
                return GuardrailVerdict.reroute("escalation: " + draft.text());
            default:
                break;
        }

        try {
            AgentResponse response =
                    AgentResponseParser.parse(draft.text(), draft.chunks(), ResponderType.ACCOUNT_SPECIFIC);
            return GuardrailVerdict.pass(response);
        } catch (ResponseFormatException e) {
            log.warn("Malformed account response sessionId={} reason={}", session.id(), e.getMessage());
            return GuardrailVerdict.regenerate(e.getMessage());
        }
    }
}
