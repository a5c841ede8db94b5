package com.telcomax.assistant.agent;

public class ResponseFormatException extends RuntimeException {

    public ResponseFormatException(String message) {
        super(message);
    }

    public ResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
