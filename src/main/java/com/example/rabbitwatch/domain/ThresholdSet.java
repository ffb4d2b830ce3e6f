package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-workspace alert thresholds. A fully populated set is what the
 * classifier consumes; a sparse one is a partial update.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThresholdSet {

    private MetricThreshold memory;
    /** Percentage of disk free: lower is worse. */
    private MetricThreshold disk;
    private MetricThreshold fileDescriptors;
    private MetricThreshold sockets;
    private MetricThreshold processes;
    private MetricThreshold queueMessages;
    private MetricThreshold unackedMessages;
    /** Minimum acceptable utilization; warning only. */
    private MetricThreshold consumerUtilization;
    private MetricThreshold connections;
    private MetricThreshold runQueue;

    /** Built-in thresholds used until a workspace stores its own. */
    public static ThresholdSet defaults() {
        return ThresholdSet.builder()
            .memory(MetricThreshold.of(80, 95))
            .disk(MetricThreshold.of(15, 10))
            .fileDescriptors(MetricThreshold.of(80, 90))
            .sockets(MetricThreshold.of(80, 90))
            .processes(MetricThreshold.of(80, 90))
            .queueMessages(MetricThreshold.of(10_000, 50_000))
            .unackedMessages(MetricThreshold.of(1_000, 5_000))
            .consumerUtilization(MetricThreshold.warningOnly(10))
            .connections(MetricThreshold.of(80, 95))
            .runQueue(MetricThreshold.of(10, 20))
            .build();
    }

    public MetricThreshold get(ThresholdMetric metric) {
        return switch (metric) {
            case MEMORY -> memory;
            case DISK -> disk;
            case FILE_DESCRIPTORS -> fileDescriptors;
            case SOCKETS -> sockets;
            case PROCESSES -> processes;
            case QUEUE_MESSAGES -> queueMessages;
            case UNACKED_MESSAGES -> unackedMessages;
            case CONSUMER_UTILIZATION -> consumerUtilization;
            case CONNECTIONS -> connections;
            case RUN_QUEUE -> runQueue;
        };
    }

    public void set(ThresholdMetric metric, MetricThreshold value) {
        switch (metric) {
            case MEMORY -> memory = value;
            case DISK -> disk = value;
            case FILE_DESCRIPTORS -> fileDescriptors = value;
            case SOCKETS -> sockets = value;
            case PROCESSES -> processes = value;
            case QUEUE_MESSAGES -> queueMessages = value;
            case UNACKED_MESSAGES -> unackedMessages = value;
            case CONSUMER_UTILIZATION -> consumerUtilization = value;
            case CONNECTIONS -> connections = value;
            case RUN_QUEUE -> runQueue = value;
        }
    }

    /** A copy with every bound present in {@code partial} laid over this set. */
    public ThresholdSet mergedWith(ThresholdSet partial) {
        ThresholdSet merged = toBuilder().build();
        if (partial == null) {
            return merged;
        }
        for (ThresholdMetric metric : ThresholdMetric.values()) {
            MetricThreshold current = get(metric);
            MetricThreshold update = partial.get(metric);
            if (update != null) {
                merged.set(metric, current != null ? current.mergedWith(update) : update);
            }
        }
        return merged;
    }

    @JsonIgnore
    public boolean isEmpty() {
        for (ThresholdMetric metric : ThresholdMetric.values()) {
            if (get(metric) != null) {
                return false;
            }
        }
        return true;
    }
}
