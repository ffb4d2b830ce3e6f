package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.AlertCategory;
import com.example.rabbitwatch.domain.AlertDetails;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.AlertSource;
import com.example.rabbitwatch.domain.CandidateAlert;
import com.example.rabbitwatch.domain.ClusterMetrics;
import com.example.rabbitwatch.domain.MetricThreshold;
import com.example.rabbitwatch.domain.MetricsSnapshot;
import com.example.rabbitwatch.domain.NodeMetrics;
import com.example.rabbitwatch.domain.QueueMetrics;
import com.example.rabbitwatch.domain.ThresholdMetric;
import com.example.rabbitwatch.domain.ThresholdSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Alert Classifier - turns one metrics snapshot into candidate alerts.
 *
 * For every threshold family the critical bound is checked before the
 * warning bound, so a value past both is reported once, at critical.
 * Alarm flags, partitions and queue-shape conditions are evaluated
 * alongside the threshold families.
 *
 * Classification has no side effects besides logging and depends only on
 * its arguments: "now" is the snapshot's capture time.
 */
@Slf4j
@Component
public class AlertClassifier {

    static final String DEFAULT_VHOST = "/";
    static final long STALE_READY_MESSAGES = 100;
    static final long ACCUMULATION_MIN_DEPTH = 1000;
    static final double ACCUMULATION_RATIO = 0.5;
    static final Duration INACTIVE_AFTER = Duration.ofHours(24);

    private static final Rule MEMORY = new Rule(ThresholdMetric.MEMORY, AlertCategory.MEMORY,
            "Critical Memory Usage", "High Memory Usage", "memory usage",
            "Consider scaling or optimizing memory usage",
            "Monitor memory usage and consider optimization");
    private static final Rule DISK = new Rule(ThresholdMetric.DISK, AlertCategory.DISK,
            "Critical Disk Space", "Low Disk Space", "free disk space",
            "Free disk space immediately",
            "Monitor disk usage and consider cleanup");
    private static final Rule FILE_DESCRIPTORS = new Rule(ThresholdMetric.FILE_DESCRIPTORS, AlertCategory.CONNECTION,
            "Critical File Descriptor Usage", "High File Descriptor Usage", "file descriptor usage",
            "Increase the file descriptor ulimit or reduce connections",
            "Monitor file descriptor usage");
    private static final Rule SOCKETS = new Rule(ThresholdMetric.SOCKETS, AlertCategory.CONNECTION,
            "Critical Socket Usage", "High Socket Usage", "socket usage",
            "Increase the socket limit or reduce connections",
            "Monitor socket usage");
    private static final Rule PROCESSES = new Rule(ThresholdMetric.PROCESSES, AlertCategory.PERFORMANCE,
            "Critical Process Usage", "High Process Usage", "Erlang process usage",
            "Investigate process leaks and restart if necessary",
            "Monitor process usage patterns");
    private static final Rule RUN_QUEUE = new Rule(ThresholdMetric.RUN_QUEUE, AlertCategory.PERFORMANCE,
            "Critical Run Queue Length", "High Run Queue Length", "run queue length",
            "System is overloaded, consider scaling or load balancing",
            "Monitor system load and performance");
    private static final Rule QUEUE_MESSAGES = new Rule(ThresholdMetric.QUEUE_MESSAGES, AlertCategory.QUEUE,
            "Critical Queue Backlog", "High Queue Backlog", "message count",
            "Scale consumers or investigate processing issues",
            "Monitor consumer performance");
    private static final Rule UNACKED_MESSAGES = new Rule(ThresholdMetric.UNACKED_MESSAGES, AlertCategory.QUEUE,
            "Critical Unacknowledged Messages", "High Unacknowledged Messages", "unacknowledged message count",
            "Check consumer acknowledgment patterns and restart consumers if necessary",
            "Monitor consumer acknowledgment patterns");
    private static final Rule CONSUMER_UTILIZATION = new Rule(ThresholdMetric.CONSUMER_UTILIZATION,
            AlertCategory.PERFORMANCE,
            "Low Consumer Utilization", "Low Consumer Utilization", "consumer utilization",
            "Check consumer performance or reduce consumer count",
            "Check consumer performance or reduce consumer count");
    private static final Rule CONNECTIONS = new Rule(ThresholdMetric.CONNECTIONS, AlertCategory.CONNECTION,
            "Critical Connection Count", "High Connection Count", "connection usage",
            "Raise the connection limit or find clients leaking connections",
            "Monitor connection growth");

    /**
     * Classify a snapshot. Output order follows the snapshot: nodes, then
     * queues, then the cluster.
     */
    public List<CandidateAlert> classify(MetricsSnapshot snapshot, ThresholdSet thresholds) {
        List<CandidateAlert> candidates = new ArrayList<>();
        if (snapshot == null || thresholds == null) {
            log.warn("Skipping classification: snapshot or thresholds missing");
            return candidates;
        }
        Context ctx = new Context(snapshot, thresholds, candidates);

        for (NodeMetrics node : snapshot.nodes()) {
            if (node == null || isBlank(node.name())) {
                log.warn("Server {}: skipping node entry without a name", snapshot.serverId());
                continue;
            }
            classifyNode(ctx, node);
        }
        for (QueueMetrics queue : snapshot.queues()) {
            if (queue == null || isBlank(queue.name())) {
                log.warn("Server {}: skipping queue entry without a name", snapshot.serverId());
                continue;
            }
            classifyQueue(ctx, queue);
        }
        if (snapshot.cluster() != null) {
            classifyCluster(ctx, snapshot.cluster());
        }
        return candidates;
    }

    private void classifyNode(Context ctx, NodeMetrics node) {
        AlertSource source = AlertSource.node(node.name());
        List<String> affected = List.of(node.name());

        if (!node.running()) {
            ctx.add(AlertSeverity.CRITICAL, AlertCategory.NODE, source, null,
                    "Node Down",
                    "RabbitMQ node " + node.name() + " is not running",
                    new AlertDetails("offline", null, "Check node logs and restart if necessary", affected));
        }
        if (node.memoryAlarm()) {
            ctx.add(AlertSeverity.CRITICAL, AlertCategory.MEMORY, source, null,
                    "Memory Alarm Active",
                    "Memory alarm is active on node " + node.name(),
                    new AlertDetails("alarm_active", null, "Free memory or increase the memory limit", affected));
        }
        if (node.diskFreeAlarm()) {
            ctx.add(AlertSeverity.CRITICAL, AlertCategory.DISK, source, null,
                    "Disk Space Alarm",
                    "Disk space alarm is active on node " + node.name(),
                    new AlertDetails("alarm_active", null, "Free disk space or lower the disk limit", affected));
        }
        if (!node.partitions().isEmpty()) {
            List<String> partitioned = new ArrayList<>();
            partitioned.add(node.name());
            partitioned.addAll(node.partitions());
            ctx.add(AlertSeverity.CRITICAL, AlertCategory.NODE, source, null,
                    "Network Partition Detected",
                    "Node " + node.name() + " has network partitions",
                    new AlertDetails(String.join(", ", node.partitions()), null,
                            "Resolve network connectivity issues immediately", partitioned));
        }

        ctx.check(MEMORY, source, null, "Node", node.memoryUsedPercent());
        ctx.check(DISK, source, null, "Node", node.diskFreePercent());
        ctx.check(FILE_DESCRIPTORS, source, null, "Node", node.fileDescriptorsUsedPercent());
        ctx.check(SOCKETS, source, null, "Node", node.socketsUsedPercent());
        ctx.check(PROCESSES, source, null, "Node", node.processesUsedPercent());
        ctx.check(RUN_QUEUE, source, null, "Node",
                node.runQueue() != null ? node.runQueue().doubleValue() : null);
    }

    private void classifyQueue(Context ctx, QueueMetrics queue) {
        String vhost = isBlank(queue.vhost()) ? DEFAULT_VHOST : queue.vhost();
        AlertSource source = AlertSource.queue(queue.name());
        List<String> affected = List.of(queue.name());
        if (queue.messages() < 0 || queue.messagesReady() < 0 || queue.messagesUnacknowledged() < 0
                || queue.consumers() < 0) {
            log.warn("Server {}: queue {} reports negative counters, skipping",
                    ctx.snapshot.serverId(), queue.name());
            return;
        }

        ctx.check(QUEUE_MESSAGES, source, vhost, "Queue", (double) queue.messages());

        if (queue.messages() > 0 && queue.consumers() == 0) {
            ctx.add(AlertSeverity.WARNING, AlertCategory.QUEUE, source, vhost,
                    "Queue Without Consumers",
                    "Queue " + queue.name() + " has messages but no consumers",
                    new AlertDetails(queue.messages() + " messages, 0 consumers", null,
                            "Start consumers or check consumer connectivity", affected));
        }

        ctx.check(UNACKED_MESSAGES, source, vhost, "Queue", (double) queue.messagesUnacknowledged());

        if (queue.consumers() > 0) {
            ctx.check(CONSUMER_UTILIZATION, source, vhost, "Queue", queue.consumerUtilization());
        }

        if (queue.consumers() > 0 && queue.messagesReady() > STALE_READY_MESSAGES && queue.deliverRate() == 0) {
            ctx.add(AlertSeverity.WARNING, AlertCategory.QUEUE, source, vhost,
                    "Stale Messages Detected",
                    "Queue " + queue.name() + " has ready messages but no delivery activity",
                    new AlertDetails(queue.messagesReady() + " ready messages, 0 delivery rate", null,
                            "Check consumer health and queue bindings", affected));
        }

        double publish = queue.publishRate();
        double deliver = queue.deliverRate();
        if (publish > 0 && deliver > 0 && queue.messages() > ACCUMULATION_MIN_DEPTH
                && (publish - deliver) / publish > ACCUMULATION_RATIO) {
            ctx.add(AlertSeverity.WARNING, AlertCategory.PERFORMANCE, source, vhost,
                    "Message Accumulation",
                    "Queue " + queue.name() + " is accumulating messages faster than they are processed",
                    new AlertDetails(String.format(Locale.ROOT, "Publish: %.2f/s, Deliver: %.2f/s", publish, deliver),
                            null, "Scale consumers or optimize message processing", affected));
        }

        if (queue.messages() == 0 && queue.consumers() == 0 && queue.idleSince() != null
                && ctx.snapshot.capturedAt() != null) {
            Duration idle = Duration.between(queue.idleSince(), ctx.snapshot.capturedAt());
            if (idle.compareTo(INACTIVE_AFTER) > 0) {
                ctx.add(AlertSeverity.INFO, AlertCategory.QUEUE, source, vhost,
                        "Inactive Queue",
                        "Queue " + queue.name() + " has been inactive for over 24 hours",
                        new AlertDetails(idle.toHours() + " hours since last activity", null,
                                "Consider removing the queue if it is no longer needed", affected));
            }
        }
    }

    private void classifyCluster(Context ctx, ClusterMetrics cluster) {
        Long limit = cluster.connectionLimit();
        if (limit == null || limit <= 0) {
            log.debug("Server {}: no connection limit known, skipping connection check", ctx.snapshot.serverId());
            return;
        }
        if (cluster.connectionCount() < 0) {
            log.warn("Server {}: negative connection count {}, skipping", ctx.snapshot.serverId(),
                    cluster.connectionCount());
            return;
        }
        String name = isBlank(cluster.clusterName()) ? ctx.snapshot.serverName() : cluster.clusterName();
        double percent = cluster.connectionCount() * 100.0 / limit;
        ctx.check(CONNECTIONS, AlertSource.cluster(name), null, "Cluster", percent);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Object displayValue(ThresholdMetric metric, double value) {
        return metric.isPercentage() ? Math.round(value) : (long) value;
    }

    private static String format(ThresholdMetric metric, double value) {
        String number = value == Math.rint(value)
                ? String.valueOf((long) value)
                : String.format(Locale.ROOT, "%.1f", value);
        return metric.isPercentage() ? number + "%" : number;
    }

    private record Rule(ThresholdMetric metric, AlertCategory category, String criticalTitle, String warningTitle,
                        String subject, String criticalHint, String warningHint) {
    }

    /** Per-call state; keeps {@link #classify} free of shared mutable fields. */
    private static final class Context {
        private final MetricsSnapshot snapshot;
        private final ThresholdSet thresholds;
        private final List<CandidateAlert> out;

        private Context(MetricsSnapshot snapshot, ThresholdSet thresholds, List<CandidateAlert> out) {
            this.snapshot = snapshot;
            this.thresholds = thresholds;
            this.out = out;
        }

        void check(Rule rule, AlertSource source, String vhost, String sourceLabel, Double value) {
            if (value == null) {
                return;
            }
            if (value.isNaN() || value.isInfinite() || value < 0) {
                log.warn("Server {}: ignoring malformed {} value {} on {}",
                        snapshot.serverId(), rule.metric().getKey(), value, source.name());
                return;
            }
            MetricThreshold bounds = thresholds.get(rule.metric());
            if (bounds == null) {
                return;
            }
            AlertSeverity severity;
            double bound;
            if (bounds.critical() != null && rule.metric().breaches(value, bounds.critical())) {
                severity = AlertSeverity.CRITICAL;
                bound = bounds.critical();
            } else if (bounds.warning() != null && rule.metric().breaches(value, bounds.warning())) {
                severity = AlertSeverity.WARNING;
                bound = bounds.warning();
            } else {
                return;
            }
            boolean critical = severity == AlertSeverity.CRITICAL;
            add(severity, rule.category(), source, vhost,
                    critical ? rule.criticalTitle() : rule.warningTitle(),
                    String.format(Locale.ROOT, "%s %s %s is %s (threshold %s)",
                            sourceLabel, source.name(), rule.subject(),
                            format(rule.metric(), value), format(rule.metric(), bound)),
                    new AlertDetails(displayValue(rule.metric(), value), bound,
                            critical ? rule.criticalHint() : rule.warningHint(), List.of(source.name())));
        }

        void add(AlertSeverity severity, AlertCategory category, AlertSource source, String vhost,
                 String title, String description, AlertDetails details) {
            out.add(CandidateAlert.builder()
                    .serverId(snapshot.serverId())
                    .serverName(snapshot.serverName())
                    .severity(severity)
                    .category(category)
                    .title(title)
                    .description(description)
                    .details(details)
                    .source(source)
                    .vhost(vhost)
                    .build());
        }
    }
}
