package com.example.rabbitwatch.notification;

/**
 * Plain-text alert email.
 */
public record EmailMessage(String to, String subject, String body) {
}
