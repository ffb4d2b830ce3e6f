package com.example.rabbitwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RabbitWatch - alert detection and notification for RabbitMQ clusters.
 *
 * Architecture:
 * - Monitoring scheduler → polls each registered server through the management API
 * - Alert classifier → turns a metrics snapshot into candidate alerts
 * - Lifecycle tracker → reconciles candidates into active / resolved alerts
 * - Notification dispatcher → fans new alerts out to email, Slack and webhooks
 * - Alerts gateway → pushes alert events to connected browsers
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class RabbitWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(RabbitWatchApplication.class, args);
    }
}
