package com.telcomax.assistant.rag;

public class VectorIndexException extends RuntimeException {

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
