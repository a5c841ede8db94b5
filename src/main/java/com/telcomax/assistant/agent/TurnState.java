package com.telcomax.assistant.agent;

public enum TurnState {
    ROUTING,
    MEMORY_MERGE,
    DISPATCH,
    GUARDRAIL_CHECK,
    REROUTE,
    VALIDATE,
    APPROVED,
    REJECTED,
    ERROR;

    public boolean terminal() {
        return this == APPROVED || this == REJECTED || this == ERROR;
    }
}
