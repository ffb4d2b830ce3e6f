package com.example.rabbitwatch.exception;

import java.util.List;

/**
 * A threshold update that would break a warning/critical invariant.
 * Nothing is persisted when this is thrown.
 */
public class ThresholdValidationException extends RabbitWatchException {

    private final List<String> violations;
    private final List<String> metrics;

    public ThresholdValidationException(List<String> metrics, List<String> violations) {
        super("validation_failed", "Invalid thresholds: " + String.join(", ", metrics));
        this.metrics = List.copyOf(metrics);
        this.violations = List.copyOf(violations);
    }

    /** Names of the offending metrics, in declaration order, without duplicates. */
    public List<String> getMetrics() {
        return metrics;
    }

    public List<String> getViolations() {
        return violations;
    }
}
