package com.example.rabbitwatch.controller;

import com.example.rabbitwatch.alerting.AlertDetectionService;
import com.example.rabbitwatch.alerting.AlertFilter;
import com.example.rabbitwatch.alerting.AlertQueryService;
import com.example.rabbitwatch.alerting.DetectionResult;
import com.example.rabbitwatch.alerting.HealthCheckService;
import com.example.rabbitwatch.domain.AlertCategory;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.ClusterHealthSummary;
import com.example.rabbitwatch.domain.NotificationSettings;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.domain.ThresholdSet;
import com.example.rabbitwatch.exception.InvalidRequestException;
import com.example.rabbitwatch.service.NotificationSettingsService;
import com.example.rabbitwatch.service.PlanService;
import com.example.rabbitwatch.service.ThresholdService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alerts, health, thresholds and alert settings of a workspace.
 */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}")
@RequiredArgsConstructor
public class AlertController {

    private final AlertQueryService alertQueryService;
    private final AlertDetectionService detectionService;
    private final HealthCheckService healthCheckService;
    private final ThresholdService thresholdService;
    private final PlanService planService;
    private final NotificationSettingsService notificationSettingsService;

    // Alerts

    @GetMapping("/servers/{serverId}/alerts")
    public ResponseEntity<AlertQueryService.ServerAlerts> getServerAlerts(
            @PathVariable String workspaceId,
            @PathVariable String serverId,
            @RequestParam String vhost,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        AlertFilter filter = new AlertFilter(severity(severity), category(category), resolved, vhost, limit, offset);
        return ResponseEntity.ok(alertQueryService.getServerAlerts(workspaceId, serverId, filter));
    }

    @GetMapping("/servers/{serverId}/alerts/resolved")
    public ResponseEntity<AlertQueryService.ResolvedAlerts> getResolvedAlerts(
            @PathVariable String workspaceId,
            @PathVariable String serverId,
            @RequestParam(required = false) String vhost,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        AlertFilter filter = new AlertFilter(severity(severity), category(category), null, vhost, limit, offset);
        return ResponseEntity.ok(alertQueryService.getResolvedAlerts(workspaceId, serverId, filter));
    }

    @PostMapping("/servers/{serverId}/alerts/check")
    public ResponseEntity<DetectionResult> runCheck(@PathVariable String workspaceId,
                                                    @PathVariable String serverId) {
        RabbitServer server = alertQueryService.requireServer(workspaceId, serverId);
        return ResponseEntity.ok(detectionService.runDetectionCycle(server));
    }

    @GetMapping("/servers/{serverId}/health")
    public ResponseEntity<Map<String, Object>> getHealth(@PathVariable String workspaceId,
                                                         @PathVariable String serverId) {
        RabbitServer server = alertQueryService.requireServer(workspaceId, serverId);
        return ResponseEntity.ok(Map.of("health", healthCheckService.getHealthCheck(server)));
    }

    @GetMapping("/servers/{serverId}/cluster-health")
    public ResponseEntity<ClusterHealthSummary> getClusterHealth(@PathVariable String workspaceId,
                                                                 @PathVariable String serverId) {
        return ResponseEntity.ok(alertQueryService.getClusterHealth(workspaceId, serverId));
    }

    // Thresholds

    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds(@PathVariable String workspaceId) {
        planService.requireWorkspace(workspaceId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("thresholds", thresholdService.getThresholds(workspaceId));
        body.put("canModify", planService.canModifyThresholds(workspaceId));
        body.put("defaults", thresholdService.getDefaults());
        return ResponseEntity.ok(body);
    }

    @PutMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> updateThresholds(@PathVariable String workspaceId,
                                                                @RequestBody ThresholdUpdateRequest request) {
        planService.requireWorkspace(workspaceId);
        ThresholdSet updated = thresholdService.updateThresholds(workspaceId, request.thresholds());
        return ResponseEntity.ok(Map.of(
                "message", "Alert thresholds updated",
                "thresholds", updated));
    }

    // Alert settings

    @GetMapping("/alert-settings")
    public ResponseEntity<NotificationSettings> getAlertSettings(@PathVariable String workspaceId) {
        return ResponseEntity.ok(notificationSettingsService.getSettings(workspaceId));
    }

    @PutMapping("/alert-settings")
    public ResponseEntity<NotificationSettings> updateAlertSettings(@PathVariable String workspaceId,
                                                                    @RequestHeader("X-User-Id") String userId,
                                                                    @RequestBody NotificationSettings update) {
        return ResponseEntity.ok(notificationSettingsService.updateSettings(workspaceId, userId, update));
    }

    public record ThresholdUpdateRequest(ThresholdSet thresholds) {
    }

    private static AlertSeverity severity(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return AlertSeverity.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown severity: " + value);
        }
    }

    private static AlertCategory category(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return AlertCategory.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown category: " + value);
        }
    }
}
