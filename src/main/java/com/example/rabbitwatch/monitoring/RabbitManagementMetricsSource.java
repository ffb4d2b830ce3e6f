package com.example.rabbitwatch.monitoring;

import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.example.rabbitwatch.domain.ClusterMetrics;
import com.example.rabbitwatch.domain.NodeMetrics;
import com.example.rabbitwatch.domain.QueueMetrics;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.exception.MetricsUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads metrics from the RabbitMQ management plugin's HTTP API
 * ({@code /api/overview}, {@code /api/nodes}, {@code /api/queues}) and
 * derives the percentages the classifier works with.
 */
@Slf4j
@Component
public class RabbitManagementMetricsSource implements MetricsSource {

    private static final DateTimeFormatter IDLE_SINCE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RabbitManagementMetricsSource(OkHttpClient httpClient, ObjectMapper objectMapper,
                                         RabbitWatchProperties properties) {
        int timeout = properties.getManagement().getTimeoutSeconds();
        this.httpClient = httpClient.newBuilder()
                .connectTimeout(timeout, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .callTimeout(timeout, TimeUnit.SECONDS)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public ClusterMetrics fetchOverview(RabbitServer server) throws MetricsUnavailableException {
        JsonNode overview = get(server, "/api/overview");
        String clusterName = overview.path("cluster_name").asText(server.getName());
        long connections = overview.path("object_totals").path("connections").asLong(0);
        return new ClusterMetrics(clusterName, connections, server.getMaxConnections());
    }

    @Override
    public List<NodeMetrics> fetchNodes(RabbitServer server) throws MetricsUnavailableException {
        JsonNode nodes = get(server, "/api/nodes");
        if (!nodes.isArray()) {
            throw new MetricsUnavailableException("Unexpected /api/nodes response from " + server.getName());
        }
        List<NodeMetrics> result = new ArrayList<>();
        for (JsonNode node : nodes) {
            result.add(toNodeMetrics(node));
        }
        return result;
    }

    @Override
    public List<QueueMetrics> fetchQueues(RabbitServer server) throws MetricsUnavailableException {
        JsonNode queues = get(server, "/api/queues");
        if (!queues.isArray()) {
            throw new MetricsUnavailableException("Unexpected /api/queues response from " + server.getName());
        }
        List<QueueMetrics> result = new ArrayList<>();
        for (JsonNode queue : queues) {
            result.add(toQueueMetrics(queue));
        }
        return result;
    }

    NodeMetrics toNodeMetrics(JsonNode node) {
        List<String> partitions = new ArrayList<>();
        node.path("partitions").forEach(p -> partitions.add(p.asText()));

        long socketsTotal = node.path("sockets_total").asLong(0);
        return NodeMetrics.builder()
                .name(node.path("name").asText(null))
                .running(node.path("running").asBoolean(false))
                .memoryAlarm(node.path("mem_alarm").asBoolean(false))
                .diskFreeAlarm(node.path("disk_free_alarm").asBoolean(false))
                .partitions(partitions)
                .memoryUsedPercent(percent(node, "mem_used", "mem_limit"))
                .diskFreePercent(diskFreePercent(node))
                .fileDescriptorsUsedPercent(percent(node, "fd_used", "fd_total"))
                .socketsUsedPercent(percent(node, "sockets_used", "sockets_total"))
                .socketsTotal(socketsTotal > 0 ? socketsTotal : null)
                .processesUsedPercent(percent(node, "proc_used", "proc_total"))
                .runQueue(node.hasNonNull("run_queue") ? node.get("run_queue").asInt() : null)
                .build();
    }

    QueueMetrics toQueueMetrics(JsonNode queue) {
        JsonNode stats = queue.path("message_stats");
        double publishRate = stats.path("publish_details").path("rate").asDouble(0);
        double deliverRate = stats.path("deliver_get_details").path("rate").asDouble(0);
        // Nothing published means nothing is waiting on the consumers.
        double utilization = publishRate > 0 ? deliverRate / publishRate * 100 : 100;

        return QueueMetrics.builder()
                .name(queue.path("name").asText(null))
                .vhost(queue.path("vhost").asText("/"))
                .messages(queue.path("messages").asLong(0))
                .messagesReady(queue.path("messages_ready").asLong(0))
                .messagesUnacknowledged(queue.path("messages_unacknowledged").asLong(0))
                .consumers(queue.path("consumers").asInt(0))
                .consumerUtilization(utilization)
                .publishRate(publishRate)
                .deliverRate(deliverRate)
                .idleSince(parseIdleSince(queue.path("idle_since").asText(null)))
                .build();
    }

    private JsonNode get(RabbitServer server, String path) throws MetricsUnavailableException {
        String baseUrl = server.getManagementUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new MetricsUnavailableException("No management URL configured for " + server.getName());
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        Request.Builder request = new Request.Builder()
                .url(baseUrl + path)
                .header("Accept", "application/json");
        if (server.getUsername() != null) {
            request.header("Authorization",
                    Credentials.basic(server.getUsername(), server.getPassword() != null ? server.getPassword() : ""));
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new MetricsUnavailableException(String.format("Management API %s returned HTTP %d for %s",
                        path, response.code(), server.getName()));
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new MetricsUnavailableException("Empty " + path + " response from " + server.getName());
            }
            return objectMapper.readTree(body.string());
        } catch (IOException | IllegalArgumentException e) {
            throw new MetricsUnavailableException(
                    "Failed to read " + path + " from " + server.getName() + ": " + e.getMessage(), e);
        }
    }

    private static Double percent(JsonNode node, String usedField, String totalField) {
        if (!node.hasNonNull(usedField)) {
            return null;
        }
        double total = node.path(totalField).asDouble(0);
        if (total <= 0) {
            return null;
        }
        return node.get(usedField).asDouble() / total * 100;
    }

    /**
     * Free space relative to the configured free-space limit, capped at 100.
     * Values above the limit are healthy; the cap keeps the figure a percentage.
     */
    private static Double diskFreePercent(JsonNode node) {
        if (!node.hasNonNull("disk_free")) {
            return null;
        }
        double limit = node.path("disk_free_limit").asDouble(0);
        if (limit <= 0) {
            return null;
        }
        return Math.min(100.0, node.get("disk_free").asDouble() / limit * 100);
    }

    private static Instant parseIdleSince(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, IDLE_SINCE_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException iso) {
                log.debug("Unparseable idle_since value: {}", value);
                return null;
            }
        }
    }
}
