package com.example.rabbitwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for RabbitWatch.
 * Maps to the 'rabbitwatch' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rabbitwatch")
public class RabbitWatchProperties {

    private MonitoringConfig monitoring = new MonitoringConfig();
    private AlertsConfig alerts = new AlertsConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private ManagementConfig management = new ManagementConfig();

    @Data
    public static class MonitoringConfig {
        private boolean enabled = true;
        /** How often the scheduler wakes up to look for servers that are due. */
        private long tickMillis = 5000;
        private int defaultPollIntervalSeconds = 60;
        private int cycleTimeoutSeconds = 30;
    }

    @Data
    public static class AlertsConfig {
        private int resolvedRetentionDays = 30;
        private String purgeCron = "0 0 * * * *";
        private int maxHealthIssues = 5;
    }

    @Data
    public static class NotificationConfig {
        /** Base URL of the dashboard; the Slack "View Alerts" button is omitted when blank. */
        private String dashboardUrl = "";
        private int timeoutSeconds = 10;
        private RetryConfig retry = new RetryConfig();
        private SlackConfig slack = new SlackConfig();
        private EmailConfig email = new EmailConfig();
        private WebhookConfig webhook = new WebhookConfig();

        @Data
        public static class RetryConfig {
            private int maxRetries = 3;
            private long baseDelayMillis = 1000;
        }

        @Data
        public static class SlackConfig {
            private String username = "RabbitWatch Alerts";
            private String iconEmoji = ":rabbit:";
        }

        @Data
        public static class EmailConfig {
            private String from = "alerts@rabbitwatch.local";
        }

        @Data
        public static class WebhookConfig {
            private String userAgent = "RabbitWatch-Webhook/1.0";
        }
    }

    @Data
    public static class ManagementConfig {
        private int timeoutSeconds = 10;
    }
}
