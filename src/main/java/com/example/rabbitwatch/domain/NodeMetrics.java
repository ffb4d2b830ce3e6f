package com.example.rabbitwatch.domain;

import lombok.Builder;

import java.util.List;

/**
 * Point-in-time metrics for one broker node. Percentages are 0-100;
 * a null value means the source did not report it.
 */
@Builder
public record NodeMetrics(
        String name,
        boolean running,
        boolean memoryAlarm,
        boolean diskFreeAlarm,
        List<String> partitions,
        Double memoryUsedPercent,
        Double diskFreePercent,
        Double fileDescriptorsUsedPercent,
        Double socketsUsedPercent,
        Long socketsTotal,
        Double processesUsedPercent,
        Integer runQueue) {

    public NodeMetrics {
        partitions = partitions != null ? List.copyOf(partitions) : List.of();
    }
}
