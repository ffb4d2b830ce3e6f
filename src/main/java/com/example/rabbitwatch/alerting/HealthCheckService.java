package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.HealthCheck;
import com.example.rabbitwatch.domain.HealthCheck.ComponentCheck;
import com.example.rabbitwatch.domain.HealthStatus;
import com.example.rabbitwatch.domain.MetricThreshold;
import com.example.rabbitwatch.domain.NodeMetrics;
import com.example.rabbitwatch.domain.QueueMetrics;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.domain.ThresholdSet;
import com.example.rabbitwatch.exception.MetricsUnavailableException;
import com.example.rabbitwatch.monitoring.MetricsSource;
import com.example.rabbitwatch.service.ThresholdService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probes a server directly, independent of the alert pipeline. Each
 * component is checked on its own; a component whose data can't be
 * fetched is critical while the others still report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private static final String UNCHECKED = "Not checked: node data unavailable";

    private final MetricsSource metricsSource;
    private final ThresholdService thresholdService;
    private final Clock clock;

    public HealthCheck getHealthCheck(RabbitServer server) {
        ThresholdSet thresholds = thresholdService.getThresholds(server.getWorkspaceId());
        Map<String, ComponentCheck> checks = new LinkedHashMap<>();

        checks.put("connectivity", checkConnectivity(server));

        List<NodeMetrics> nodes = null;
        try {
            nodes = metricsSource.fetchNodes(server);
        } catch (MetricsUnavailableException e) {
            log.warn("Health check could not read nodes of {}: {}", server.getName(), e.getMessage());
            checks.put("nodes", ComponentCheck.of(HealthStatus.CRITICAL, "Failed to check nodes: " + e.getMessage()));
            checks.put("memory", ComponentCheck.of(HealthStatus.CRITICAL, UNCHECKED));
            checks.put("disk", ComponentCheck.of(HealthStatus.CRITICAL, UNCHECKED));
        }
        if (nodes != null) {
            checks.put("nodes", checkNodes(nodes));
            checks.put("memory", checkMemory(nodes, thresholds));
            checks.put("disk", checkDisk(nodes, thresholds));
        }

        checks.put("queues", checkQueues(server, thresholds));

        HealthStatus overall = HealthStatus.HEALTHY;
        for (ComponentCheck check : checks.values()) {
            overall = overall.worst(check.status());
        }
        return new HealthCheck(overall, checks, clock.instant());
    }

    private ComponentCheck checkConnectivity(RabbitServer server) {
        try {
            metricsSource.fetchOverview(server);
            return ComponentCheck.of(HealthStatus.HEALTHY, "Successfully connected to RabbitMQ");
        } catch (MetricsUnavailableException e) {
            return ComponentCheck.of(HealthStatus.CRITICAL, "Failed to connect: " + e.getMessage());
        }
    }

    static ComponentCheck checkNodes(List<NodeMetrics> nodes) {
        long running = nodes.stream().filter(NodeMetrics::running).count();
        int total = nodes.size();

        List<Map<String, Object>> perNode = new ArrayList<>();
        for (NodeMetrics node : nodes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", node.name());
            entry.put("running", node.running());
            entry.put("memoryAlarm", node.memoryAlarm());
            entry.put("diskFreeAlarm", node.diskFreeAlarm());
            perNode.add(entry);
        }
        Map<String, Object> details = Map.of("running", running, "total", total, "nodes", perNode);

        if (total > 0 && running == total) {
            return new ComponentCheck(HealthStatus.HEALTHY, "All " + total + " nodes are running", details);
        }
        if (running > 0) {
            return new ComponentCheck(HealthStatus.WARNING, running + "/" + total + " nodes are running", details);
        }
        return new ComponentCheck(HealthStatus.CRITICAL, "No nodes are running", details);
    }

    static ComponentCheck checkMemory(List<NodeMetrics> nodes, ThresholdSet thresholds) {
        long alarms = nodes.stream().filter(NodeMetrics::memoryAlarm).count();
        if (alarms > 0) {
            return ComponentCheck.of(HealthStatus.CRITICAL, alarms + " nodes have memory alarms");
        }
        Double warning = thresholds.getMemory() != null ? thresholds.getMemory().warning() : null;
        long high = warning == null ? 0 : nodes.stream()
                .filter(n -> n.memoryUsedPercent() != null && n.memoryUsedPercent() >= warning)
                .count();
        if (high > 0) {
            return ComponentCheck.of(HealthStatus.WARNING, high + " nodes have high memory usage");
        }
        return ComponentCheck.of(HealthStatus.HEALTHY, "Memory usage is normal across all nodes");
    }

    static ComponentCheck checkDisk(List<NodeMetrics> nodes, ThresholdSet thresholds) {
        long alarms = nodes.stream().filter(NodeMetrics::diskFreeAlarm).count();
        if (alarms > 0) {
            return ComponentCheck.of(HealthStatus.CRITICAL, alarms + " nodes have disk space alarms");
        }
        Double warning = thresholds.getDisk() != null ? thresholds.getDisk().warning() : null;
        long low = warning == null ? 0 : nodes.stream()
                .filter(n -> n.diskFreePercent() != null && n.diskFreePercent() < warning)
                .count();
        if (low > 0) {
            return ComponentCheck.of(HealthStatus.WARNING, low + " nodes are low on free disk space");
        }
        return ComponentCheck.of(HealthStatus.HEALTHY, "Disk space is sufficient across all nodes");
    }

    private ComponentCheck checkQueues(RabbitServer server, ThresholdSet thresholds) {
        List<QueueMetrics> queues;
        try {
            queues = metricsSource.fetchQueues(server);
        } catch (MetricsUnavailableException e) {
            log.warn("Health check could not read queues of {}: {}", server.getName(), e.getMessage());
            return ComponentCheck.of(HealthStatus.CRITICAL, "Failed to check queues: " + e.getMessage());
        }
        return checkQueues(queues, thresholds);
    }

    static ComponentCheck checkQueues(List<QueueMetrics> queues, ThresholdSet thresholds) {
        int critical = 0;
        int warning = 0;
        int withoutConsumers = 0;
        for (QueueMetrics queue : queues) {
            switch (level(queue.messages(), thresholds.getQueueMessages())) {
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                default -> { }
            }
            switch (level(queue.messagesUnacknowledged(), thresholds.getUnackedMessages())) {
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                default -> { }
            }
            if (queue.messages() > 0 && queue.consumers() == 0) {
                withoutConsumers++;
            }
        }

        if (critical > 0) {
            return ComponentCheck.of(HealthStatus.CRITICAL, critical + " queues have critical issues");
        }
        if (warning > 0 || withoutConsumers > 0) {
            List<String> issues = new ArrayList<>();
            if (warning > 0) {
                issues.add(warning + " queues with high message count");
            }
            if (withoutConsumers > 0) {
                issues.add(withoutConsumers + " queues without consumers");
            }
            return ComponentCheck.of(HealthStatus.WARNING, String.join(", ", issues));
        }
        return ComponentCheck.of(HealthStatus.HEALTHY, "All " + queues.size() + " queues are healthy");
    }

    private static HealthStatus level(long value, MetricThreshold bounds) {
        if (bounds == null) {
            return HealthStatus.HEALTHY;
        }
        if (bounds.critical() != null && value >= bounds.critical()) {
            return HealthStatus.CRITICAL;
        }
        if (bounds.warning() != null && value >= bounds.warning()) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }
}
