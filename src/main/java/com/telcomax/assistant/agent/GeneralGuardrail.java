package com.telcomax.assistant.agent;

import com.telcomax.assistant.memory.Session;
import com.telcomax.assistant.model.AgentResponse;
import com.telcomax.assistant.model.ResponderType;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps account amounts out of general answers. A draft quoting a dollar amount while the session
 * holds an account id is discarded in favour of the account responder.
 */
@Component
public class GeneralGuardrail implements Guardrail {

    private static final Logger log = LoggerFactory.getLogger(GeneralGuardrail.class);

    @Override
    public ResponderType responder() {
        return ResponderType.GENERAL_KNOWLEDGE;
    }

    @Override
    public GuardrailVerdict check(Draft draft, Session session) {
        if (draft.kind() == Draft.Kind.ESCALATION) {
            return GuardrailVerdict.reroute("escalation: " + draft.text());
        }
        if (session.hasAccountId() && CurrencyAmounts.containsAny(draft.text())) {
            log.warn("General draft quoted an amount with an account in session sessionId={}",
                    session.id());
            return GuardrailVerdict.reroute("currency amount in general answer with account id present");
        }
        return GuardrailVerdict.pass(
                new AgentResponse(draft.text(), List.of(), draft.topScore(), ResponderType.GENERAL_KNOWLEDGE));
    }
}
