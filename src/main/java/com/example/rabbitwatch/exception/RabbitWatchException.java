package com.example.rabbitwatch.exception;

/**
 * Base class for request-facing failures. The message is safe to return
 * to API callers.
 */
public class RabbitWatchException extends RuntimeException {

    private final String errorCode;

    public RabbitWatchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
