package com.example.rabbitwatch.notification;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of delivering one batch to one channel, after retries.
 *
 * @param statusCode last HTTP status seen, null for email or network failures
 * @param attempts   number of transport calls made
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryResult(boolean success, Integer statusCode, int attempts, String error) {

    public static DeliveryResult success(Integer statusCode, int attempts) {
        return new DeliveryResult(true, statusCode, attempts, null);
    }

    public static DeliveryResult failure(Integer statusCode, int attempts, String error) {
        return new DeliveryResult(false, statusCode, attempts, error);
    }
}
