package com.example.rabbitwatch.domain;

/**
 * Cluster-wide figures. {@code connectionLimit} may be null when neither the
 * server registration nor the nodes report one.
 */
public record ClusterMetrics(String clusterName, long connectionCount, Long connectionLimit) {
}
