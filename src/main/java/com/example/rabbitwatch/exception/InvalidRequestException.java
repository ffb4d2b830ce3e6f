package com.example.rabbitwatch.exception;

public class InvalidRequestException extends RabbitWatchException {

    public InvalidRequestException(String message) {
        super("bad_request", message);
    }
}
