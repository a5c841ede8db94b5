package com.telcomax.assistant.retrieval;

public class RetrievalException extends RuntimeException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
