package com.example.rabbitwatch.monitoring;

import com.example.rabbitwatch.domain.ClusterMetrics;
import com.example.rabbitwatch.domain.MetricsSnapshot;
import com.example.rabbitwatch.domain.NodeMetrics;
import com.example.rabbitwatch.domain.QueueMetrics;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.exception.MetricsUnavailableException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Where broker metrics come from. Each call is one round trip; any failure
 * surfaces as {@link MetricsUnavailableException} so callers can treat the
 * server's state as unknown.
 */
public interface MetricsSource {

    /** Cluster-wide figures. {@code connectionLimit} is the server's configured ceiling, if any. */
    ClusterMetrics fetchOverview(RabbitServer server) throws MetricsUnavailableException;

    List<NodeMetrics> fetchNodes(RabbitServer server) throws MetricsUnavailableException;

    /** Queues across every vhost of the server. */
    List<QueueMetrics> fetchQueues(RabbitServer server) throws MetricsUnavailableException;

    /**
     * One complete poll. When the server has no configured connection
     * ceiling, the sum of the nodes' socket limits stands in for it.
     */
    default MetricsSnapshot fetchSnapshot(RabbitServer server, Instant capturedAt) throws MetricsUnavailableException {
        ClusterMetrics overview = fetchOverview(server);
        List<NodeMetrics> nodes = fetchNodes(server);
        List<QueueMetrics> queues = fetchQueues(server);

        ClusterMetrics cluster = overview;
        if (overview.connectionLimit() == null) {
            long sockets = nodes.stream()
                    .map(NodeMetrics::socketsTotal)
                    .filter(Objects::nonNull)
                    .mapToLong(Long::longValue)
                    .sum();
            cluster = new ClusterMetrics(overview.clusterName(), overview.connectionCount(),
                    sockets > 0 ? sockets : null);
        }
        return new MetricsSnapshot(server.getId(), server.getName(), capturedAt, nodes, queues, cluster);
    }
}
