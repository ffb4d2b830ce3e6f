package com.example.rabbitwatch.controller;

import com.example.rabbitwatch.domain.SlackConfig;
import com.example.rabbitwatch.domain.WebhookConfig;
import com.example.rabbitwatch.service.ChannelConfigService;
import com.example.rabbitwatch.service.ChannelConfigService.SlackConfigRequest;
import com.example.rabbitwatch.service.ChannelConfigService.WebhookConfigRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Slack and webhook channels of a workspace.
 */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}")
@RequiredArgsConstructor
public class NotificationChannelController {

    private final ChannelConfigService channelConfigService;

    @GetMapping("/slack-configs")
    public ResponseEntity<List<SlackConfig>> listSlackConfigs(@PathVariable String workspaceId) {
        return ResponseEntity.ok(channelConfigService.listSlackConfigs(workspaceId));
    }

    @PostMapping("/slack-configs")
    public ResponseEntity<SlackConfig> createSlackConfig(@PathVariable String workspaceId,
                                                         @RequestHeader("X-User-Id") String userId,
                                                         @RequestBody SlackConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(channelConfigService.createSlackConfig(workspaceId, userId, request));
    }

    @PutMapping("/slack-configs/{configId}")
    public ResponseEntity<SlackConfig> updateSlackConfig(@PathVariable String workspaceId,
                                                         @PathVariable String configId,
                                                         @RequestHeader("X-User-Id") String userId,
                                                         @RequestBody SlackConfigRequest request) {
        return ResponseEntity.ok(channelConfigService.updateSlackConfig(workspaceId, configId, userId, request));
    }

    @DeleteMapping("/slack-configs/{configId}")
    public ResponseEntity<Map<String, String>> deleteSlackConfig(@PathVariable String workspaceId,
                                                                 @PathVariable String configId,
                                                                 @RequestHeader("X-User-Id") String userId) {
        channelConfigService.deleteSlackConfig(workspaceId, configId, userId);
        return ResponseEntity.ok(Map.of("status", "deleted", "id", configId));
    }

    @GetMapping("/webhooks")
    public ResponseEntity<List<WebhookConfig>> listWebhooks(@PathVariable String workspaceId) {
        return ResponseEntity.ok(channelConfigService.listWebhooks(workspaceId));
    }

    @PostMapping("/webhooks")
    public ResponseEntity<WebhookConfig> createWebhook(@PathVariable String workspaceId,
                                                       @RequestHeader("X-User-Id") String userId,
                                                       @RequestBody WebhookConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(channelConfigService.createWebhook(workspaceId, userId, request));
    }

    @PutMapping("/webhooks/{webhookId}")
    public ResponseEntity<WebhookConfig> updateWebhook(@PathVariable String workspaceId,
                                                       @PathVariable String webhookId,
                                                       @RequestHeader("X-User-Id") String userId,
                                                       @RequestBody WebhookConfigRequest request) {
        return ResponseEntity.ok(channelConfigService.updateWebhook(workspaceId, webhookId, userId, request));
    }

    @DeleteMapping("/webhooks/{webhookId}")
    public ResponseEntity<Map<String, String>> deleteWebhook(@PathVariable String workspaceId,
                                                             @PathVariable String webhookId,
                                                             @RequestHeader("X-User-Id") String userId) {
        channelConfigService.deleteWebhook(workspaceId, webhookId, userId);
        return ResponseEntity.ok(Map.of("status", "deleted", "id", webhookId));
    }
}
