package com.example.rabbitwatch.exception;

public class ResourceNotFoundException extends RabbitWatchException {

    public ResourceNotFoundException(String resource, String id) {
        super("not_found", resource + " not found: " + id);
    }
}
