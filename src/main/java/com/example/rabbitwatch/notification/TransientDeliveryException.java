package com.example.rabbitwatch.notification;

/**
 * A delivery attempt failed in a way worth retrying: HTTP 5xx, HTTP 429,
 * a timeout or another network error.
 */
public class TransientDeliveryException extends Exception {

    private final Integer statusCode;

    public TransientDeliveryException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
