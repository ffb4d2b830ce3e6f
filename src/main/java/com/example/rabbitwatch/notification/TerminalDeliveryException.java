package com.example.rabbitwatch.notification;

/**
 * A delivery attempt failed in a way retrying cannot fix, such as a 4xx
 * other than 429 or a payload that cannot be built.
 */
public class TerminalDeliveryException extends Exception {

    private final Integer statusCode;

    public TerminalDeliveryException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TerminalDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
