package com.telcomax.assistant.agent;

public class GuardrailLoopExceededException extends RuntimeException {

    public GuardrailLoopExceededException(String message) {
        super(message);
    }

    public GuardrailLoopExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
