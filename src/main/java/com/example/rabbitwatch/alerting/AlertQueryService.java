package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.AlertSummary;
import com.example.rabbitwatch.domain.ClusterHealthSummary;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.domain.ResolvedAlertRecord;
import com.example.rabbitwatch.domain.ThresholdSet;
import com.example.rabbitwatch.exception.ResourceNotFoundException;
import com.example.rabbitwatch.repository.RabbitServerRepository;
import com.example.rabbitwatch.repository.ResolvedAlertRepository;
import com.example.rabbitwatch.service.PlanService;
import com.example.rabbitwatch.service.ThresholdService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the alert pipeline: active and resolved alerts for one
 * server, and the roll-ups built from them.
 */
@Service
@RequiredArgsConstructor
public class AlertQueryService {

    private final ActiveAlertStore activeAlerts;
    private final ResolvedAlertRepository resolvedAlertRepository;
    private final RabbitServerRepository serverRepository;
    private final ThresholdService thresholdService;
    private final PlanService planService;
    private final RabbitWatchProperties properties;
    private final Clock clock;

    public RabbitServer requireServer(String workspaceId, String serverId) {
        return serverRepository.findByIdAndWorkspaceId(serverId, workspaceId)
                .orElseThrow(() -> new ResourceNotFoundException("Server", serverId));
    }

    /**
     * Active alerts of one server as seen from {@code filter.vhost()}.
     * {@code summary} covers the whole vhost view; {@code total} counts the
     * filtered alerts before pagination. Lowest-tier workspaces get the
     * counts without the alert list.
     */
    public ServerAlerts getServerAlerts(String workspaceId, String serverId, AlertFilter filter) {
        requireServer(workspaceId, serverId);
        List<Alert> active = activeAlerts.get(workspaceId, serverId);

        List<Alert> vhostView = AlertFilter.forVhost(filter.vhost()).matching(active);
        AlertSummary summary = AlertSummary.of(vhostView);
        ThresholdSet thresholds = thresholdService.getThresholds(workspaceId);

        if (planService.getWorkspacePlan(workspaceId).isLowestTier()) {
            return new ServerAlerts(List.of(), summary, thresholds, summary.total(), clock.instant());
        }

        List<Alert> matching = filter.matching(active);
        return new ServerAlerts(filter.page(matching), summary, thresholds, matching.size(), clock.instant());
    }

    public ResolvedAlerts getResolvedAlerts(String workspaceId, String serverId, AlertFilter filter) {
        requireServer(workspaceId, serverId);
        Page<ResolvedAlertRecord> window = resolvedAlertRepository.findFiltered(workspaceId, serverId,
                filter.severity(), filter.category(), filter.vhost(), resolvedWindow(filter));
        List<Alert> resolved = window.getContent().stream()
                .map(ResolvedAlertRecord::toAlert)
                .sorted(AlertFilter.NEWEST_FIRST)
                .toList();
        return new ResolvedAlerts(filter.page(resolved), (int) window.getTotalElements(), clock.instant());
    }

    /** The first offset + limit rows; the offset itself is skipped in memory. */
    private static Pageable resolvedWindow(AlertFilter filter) {
        if (filter.limit() == null) {
            return Pageable.unpaged();
        }
        long end = (long) (filter.offset() != null ? filter.offset() : 0) + filter.limit();
        return PageRequest.of(0, (int) Math.max(1, Math.min(end, Integer.MAX_VALUE)));
    }

    /**
     * Health derived from the server's active alerts: critical when any
     * critical alert is active, degraded on any warning, healthy otherwise.
     */
    public ClusterHealthSummary getClusterHealth(String workspaceId, String serverId) {
        requireServer(workspaceId, serverId);
        List<Alert> active = new ArrayList<>(activeAlerts.get(workspaceId, serverId));
        active.sort(AlertFilter.NEWEST_FIRST);

        AlertSummary summary = AlertSummary.of(active);
        ClusterHealthSummary.ClusterHealth health;
        if (summary.critical() > 0) {
            health = ClusterHealthSummary.ClusterHealth.CRITICAL;
        } else if (summary.warning() > 0) {
            health = ClusterHealthSummary.ClusterHealth.DEGRADED;
        } else {
            health = ClusterHealthSummary.ClusterHealth.HEALTHY;
        }

        int maxIssues = properties.getAlerts().getMaxHealthIssues();
        List<String> issues = active.stream()
                .filter(a -> a.getSeverity() != AlertSeverity.INFO)
                .sorted((a, b) -> Integer.compare(b.getSeverity().getRank(), a.getSeverity().getRank()))
                .map(Alert::getDescription)
                .limit(maxIssues)
                .toList();
        return new ClusterHealthSummary(health, summary, issues, clock.instant());
    }

    public record ServerAlerts(List<Alert> alerts, AlertSummary summary, ThresholdSet thresholds, int total,
                               Instant timestamp) {
    }

    public record ResolvedAlerts(List<Alert> alerts, int total, Instant timestamp) {
    }
}
