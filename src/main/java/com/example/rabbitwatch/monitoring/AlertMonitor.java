package com.example.rabbitwatch.monitoring;

import com.example.rabbitwatch.alerting.AlertDetectionService;
import com.example.rabbitwatch.alerting.DetectionResult;
import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.repository.RabbitServerRepository;
import com.example.rabbitwatch.repository.ResolvedAlertRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives detection. Wakes up on a short tick, and runs a cycle for every
 * enabled server whose poll interval has elapsed since its last check.
 * Servers are polled in parallel; a server whose previous cycle is still
 * running is skipped until it finishes.
 */
@Slf4j
@Component
public class AlertMonitor {

    private final RabbitServerRepository serverRepository;
    private final ResolvedAlertRepository resolvedAlertRepository;
    private final AlertDetectionService detectionService;
    private final RabbitWatchProperties properties;
    private final Executor monitoringExecutor;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public AlertMonitor(RabbitServerRepository serverRepository,
                        ResolvedAlertRepository resolvedAlertRepository,
                        AlertDetectionService detectionService,
                        RabbitWatchProperties properties,
                        @Qualifier("monitoringExecutor") Executor monitoringExecutor,
                        Clock clock) {
        this.serverRepository = serverRepository;
        this.resolvedAlertRepository = resolvedAlertRepository;
        this.detectionService = detectionService;
        this.properties = properties;
        this.monitoringExecutor = monitoringExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${rabbitwatch.monitoring.tick-millis:5000}")
    public void runDueDetections() {
        if (!properties.getMonitoring().isEnabled()) return;

        List<RabbitServer> servers;
        try {
            servers = serverRepository.findByEnabled(true);
        } catch (RuntimeException e) {
            log.error("Could not load monitored servers: {}", e.getMessage());
            return;
        }
        Instant now = clock.instant();
        for (RabbitServer server : servers) {
            if (isDue(server, now)) {
                submit(server);
            }
        }
    }

    boolean isDue(RabbitServer server, Instant now) {
        int intervalSeconds = server.getPollIntervalSeconds() > 0
                ? server.getPollIntervalSeconds() : properties.getMonitoring().getDefaultPollIntervalSeconds();
        return server.getLastCheckAt() == null
                || Duration.between(server.getLastCheckAt(), now).getSeconds() >= intervalSeconds;
    }

    /**
     * Start a cycle for {@code server} unless one is already running.
     *
     * @return false when the server was skipped
     */
    boolean submit(RabbitServer server) {
        if (!inFlight.add(server.getId())) {
            log.debug("Detection for {} still running, skipping this tick", server.getName());
            return false;
        }
        log.debug("Detection due for {} (interval: {}s)", server.getName(), server.getPollIntervalSeconds());

        CompletableFuture<DetectionResult> cycle;
        try {
            cycle = CompletableFuture.supplyAsync(() -> detectionService.runDetectionCycle(server), monitoringExecutor);
        } catch (RejectedExecutionException e) {
            inFlight.remove(server.getId());
            log.warn("Monitoring pool saturated, deferring detection for {}", server.getName());
            return false;
        }

        cycle.whenComplete((result, error) -> {
            inFlight.remove(server.getId());
            if (error != null) {
                log.error("Detection for {} failed: {}", server.getName(), error.getMessage());
            }
        });
        cycle.copy()
                .orTimeout(properties.getMonitoring().getCycleTimeoutSeconds(), TimeUnit.SECONDS)
                .whenComplete((result, error) -> {
                    if (error instanceof TimeoutException) {
                        log.warn("Detection for {} has been running for over {}s",
                                server.getName(), properties.getMonitoring().getCycleTimeoutSeconds());
                    }
                });
        return true;
    }

    boolean isInFlight(String serverId) {
        return inFlight.contains(serverId);
    }

    @Scheduled(cron = "${rabbitwatch.alerts.purge-cron:0 0 * * * *}")
    public void purgeExpiredResolvedAlerts() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getAlerts().getResolvedRetentionDays()));
        try {
            int deleted = resolvedAlertRepository.deleteResolvedBefore(cutoff);
            if (deleted > 0) {
                log.info("Purged {} resolved alert(s) older than {}", deleted, cutoff);
            }
        } catch (RuntimeException e) {
            log.error("Resolved alert purge failed: {}", e.getMessage());
        }
    }
}
