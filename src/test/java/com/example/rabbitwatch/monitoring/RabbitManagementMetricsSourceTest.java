package com.example.rabbitwatch.monitoring;

import com.example.rabbitwatch.config.AppConfig;
import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.example.rabbitwatch.domain.MetricsSnapshot;
import com.example.rabbitwatch.domain.NodeMetrics;
import com.example.rabbitwatch.domain.QueueMetrics;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.exception.MetricsUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RabbitManagementMetricsSourceTest {

    private static final String NODES = """
            [{"name":"rabbit@n1","running":true,"mem_alarm":false,"disk_free_alarm":false,"partitions":[],
              "mem_used":800,"mem_limit":1000,"disk_free":3000,"disk_free_limit":1000,
              "fd_used":50,"fd_total":100,"sockets_used":10,"sockets_total":400,
              "proc_used":100,"proc_total":1000,"run_queue":3},
             {"name":"rabbit@n2","running":true,"partitions":["rabbit@n1"],
              "mem_used":100,"mem_limit":0,"disk_free":500,"disk_free_limit":1000,"sockets_total":600}]
            """;

    private static final String QUEUES = """
            [{"name":"orders","vhost":"billing","messages":1200,"messages_ready":1000,
              "messages_unacknowledged":200,"consumers":2,
              "message_stats":{"publish_details":{"rate":10.0},"deliver_get_details":{"rate":4.0}},
              "idle_since":"2026-02-27 08:15:00"},
             {"name":"idle","messages":0,"consumers":0}]
            """;

    private static final String OVERVIEW = """
            {"cluster_name":"rabbit@prod","object_totals":{"connections":250}}
            """;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private final List<Request> requests = new ArrayList<>();
    private final Map<String, Integer> statusByPath = new HashMap<>();

    private RabbitManagementMetricsSource source() {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(chain -> {
            Request request = chain.request();
            requests.add(request);
            String path = request.url().encodedPath();
            String body = switch (path) {
                case "/api/overview" -> OVERVIEW;
                case "/api/nodes" -> NODES;
                case "/api/queues" -> QUEUES;
                default -> "{}";
            };
            return new Response.Builder()
                    .request(request)
                    .protocol(Protocol.HTTP_1_1)
                    .code(statusByPath.getOrDefault(path, 200))
                    .message("scripted")
                    .body(ResponseBody.create(body, MediaType.get("application/json")))
                    .build();
        }).build();
        return new RabbitManagementMetricsSource(client, objectMapper, new RabbitWatchProperties());
    }

    private static RabbitServer server(Long maxConnections) {
        return RabbitServer.builder().id("srv-1").workspaceId("ws-1").name("prod")
                .managementUrl("http://rabbit:15672/").username("guest").password("guest")
                .maxConnections(maxConnections).build();
    }

    @Test
    @DisplayName("Node percentages are derived from used and limit figures")
    void nodeMetrics() throws Exception {
        List<NodeMetrics> nodes = source().fetchNodes(server(null));

        NodeMetrics n1 = nodes.get(0);
        assertEquals(80.0, n1.memoryUsedPercent(), 0.001);
        assertEquals(100.0, n1.diskFreePercent(), 0.001);
        assertEquals(50.0, n1.fileDescriptorsUsedPercent(), 0.001);
        assertEquals(2.5, n1.socketsUsedPercent(), 0.001);
        assertEquals(10.0, n1.processesUsedPercent(), 0.001);
        assertEquals(3, n1.runQueue());

        NodeMetrics n2 = nodes.get(1);
        assertNull(n2.memoryUsedPercent());
        assertEquals(50.0, n2.diskFreePercent(), 0.001);
        assertEquals(List.of("rabbit@n1"), n2.partitions());
        assertNull(n2.runQueue());
    }

    @Test
    @DisplayName("Queue utilization and idle time are derived from message stats")
    void queueMetrics() throws Exception {
        List<QueueMetrics> queues = source().fetchQueues(server(null));

        QueueMetrics orders = queues.get(0);
        assertEquals("billing", orders.vhost());
        assertEquals(40.0, orders.consumerUtilization(), 0.001);
        assertEquals(Instant.parse("2026-02-27T08:15:00Z"), orders.idleSince());

        QueueMetrics idle = queues.get(1);
        assertEquals("/", idle.vhost());
        assertEquals(100.0, idle.consumerUtilization(), 0.001);
        assertNull(idle.idleSince());
    }

    @Test
    @DisplayName("The connection limit falls back to the nodes' socket totals")
    void snapshotConnectionLimit() throws Exception {
        MetricsSnapshot withoutLimit = source().fetchSnapshot(server(null), Instant.EPOCH);
        MetricsSnapshot withLimit = source().fetchSnapshot(server(500L), Instant.EPOCH);

        assertEquals(1000L, withoutLimit.cluster().connectionLimit());
        assertEquals(250, withoutLimit.cluster().connectionCount());
        assertEquals("rabbit@prod", withoutLimit.cluster().clusterName());
        assertEquals(500L, withLimit.cluster().connectionLimit());
    }

    @Test
    @DisplayName("Requests use basic auth against the trimmed base URL")
    void requestShape() throws Exception {
        source().fetchOverview(server(null));

        Request request = requests.get(0);
        assertEquals("http://rabbit:15672/api/overview", request.url().toString());
        assertTrue(request.header("Authorization").startsWith("Basic "));
    }

    @Test
    @DisplayName("A non-2xx reply makes the metrics unavailable")
    void errorStatus() {
        statusByPath.put("/api/nodes", 401);

        assertThrows(MetricsUnavailableException.class, () -> source().fetchNodes(server(null)));
    }
}
