package com.example.rabbitwatch.domain;

import java.util.Collection;

public record AlertSummary(int total, int critical, int warning, int info) {

    public static AlertSummary of(Collection<Alert> alerts) {
        int critical = 0;
        int warning = 0;
        int info = 0;
        for (Alert alert : alerts) {
            switch (alert.getSeverity()) {
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                case INFO -> info++;
            }
        }
        return new AlertSummary(alerts.size(), critical, warning, info);
    }

    public static AlertSummary empty() {
        return new AlertSummary(0, 0, 0, 0);
    }
}
