package com.example.rabbitwatch.exception;

public class PermissionDeniedException extends RabbitWatchException {

    public PermissionDeniedException(String message) {
        super("forbidden", message);
    }
}
