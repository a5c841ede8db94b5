package com.telcomax.assistant.agent;

import com.telcomax.assistant.memory.Session;
import com.telcomax.assistant.model.ResponderType;

/**
 * Post-draft check for one responder type. A guardrail only judges the draft; how often a turn
 * may reroute or regenerate is decided by {@link TurnOrchestrator}.
 */
public interface Guardrail {

    ResponderType responder();

    GuardrailVerdict check(Draft draft, Session session);
}
