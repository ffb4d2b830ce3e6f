package com.example.rabbitwatch.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * The metric families that carry a configurable threshold pair.
 */
public enum ThresholdMetric {
    MEMORY("memory", Direction.HIGHER_IS_WORSE, true, true),
    DISK("disk", Direction.LOWER_IS_WORSE, true, true),
    FILE_DESCRIPTORS("fileDescriptors", Direction.HIGHER_IS_WORSE, true, true),
    SOCKETS("sockets", Direction.HIGHER_IS_WORSE, true, true),
    PROCESSES("processes", Direction.HIGHER_IS_WORSE, true, true),
    QUEUE_MESSAGES("queueMessages", Direction.HIGHER_IS_WORSE, false, true),
    UNACKED_MESSAGES("unackedMessages", Direction.HIGHER_IS_WORSE, false, true),
    CONSUMER_UTILIZATION("consumerUtilization", Direction.LOWER_IS_WORSE, true, false),
    CONNECTIONS("connections", Direction.HIGHER_IS_WORSE, true, true),
    RUN_QUEUE("runQueue", Direction.HIGHER_IS_WORSE, false, true);

    public enum Direction { HIGHER_IS_WORSE, LOWER_IS_WORSE }

    private final String key;
    private final Direction direction;
    private final boolean percentage;
    private final boolean hasCritical;

    ThresholdMetric(String key, Direction direction, boolean percentage, boolean hasCritical) {
        this.key = key;
        this.direction = direction;
        this.percentage = percentage;
        this.hasCritical = hasCritical;
    }

    /** Name used in JSON payloads and validation messages. */
    public String getKey() {
        return key;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isPercentage() {
        return percentage;
    }

    public boolean hasCritical() {
        return hasCritical;
    }

    /** Whether {@code value} has reached {@code bound} in this metric's bad direction. */
    public boolean breaches(double value, double bound) {
        return direction == Direction.HIGHER_IS_WORSE ? value >= bound : value < bound;
    }

    /** Whether {@code critical} is strictly worse than {@code warning}. */
    public boolean isOrdered(double warning, double critical) {
        return direction == Direction.HIGHER_IS_WORSE ? critical > warning : critical < warning;
    }

    public static Optional<ThresholdMetric> fromKey(String key) {
        return Arrays.stream(values()).filter(m -> m.key.equals(key)).findFirst();
    }
}
