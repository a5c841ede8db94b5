package com.telcomax.assistant.agent;

import com.telcomax.assistant.model.AgentResponse;

public record GuardrailVerdict(Outcome outcome, AgentResponse response, String reason) {

    public enum Outcome {
        PASS,
        REROUTE,
        REGENERATE
    }

    public static GuardrailVerdict pass(AgentResponse response) {
        return new GuardrailVerdict(Outcome.PASS, response, null);
    }

    public static GuardrailVerdict reroute(String reason) {
        return new GuardrailVerdict(Outcome.REROUTE, null, reason);
    }

    public static GuardrailVerdict regenerate(String reason) {
        return new GuardrailVerdict(Outcome.REGENERATE, null, reason);
    }
}
