package com.telcomax.assistant.model;

public enum ResponderType {
    GENERAL_KNOWLEDGE,
    ACCOUNT_SPECIFIC;

    public static ResponderType forIntent(IntentLabel intent) {
        return intent == IntentLabel.GENERAL_KNOWLEDGE ? GENERAL_KNOWLEDGE : ACCOUNT_SPECIFIC;
    }
}
