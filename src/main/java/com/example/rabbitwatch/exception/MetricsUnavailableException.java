package com.example.rabbitwatch.exception;

/**
 * A poll of the metrics source failed. Callers treat the server's state as
 * unknown for this cycle.
 */
public class MetricsUnavailableException extends Exception {

    public MetricsUnavailableException(String message) {
        super(message);
    }

    public MetricsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
