package com.example.rabbitwatch.domain;

import java.time.Instant;
import java.util.List;

/**
 * Everything one poll learned about a server.
 */
public record MetricsSnapshot(
        String serverId,
        String serverName,
        Instant capturedAt,
        List<NodeMetrics> nodes,
        List<QueueMetrics> queues,
        ClusterMetrics cluster) {

    public MetricsSnapshot {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        queues = queues != null ? List.copyOf(queues) : List.of();
    }
}
