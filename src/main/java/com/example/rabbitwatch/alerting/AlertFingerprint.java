package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.AlertCategory;
import com.example.rabbitwatch.domain.SourceType;

/**
 * Deterministic alert identity. The same condition on the same source maps
 * to the same key on every poll, which is what lets the lifecycle tracker
 * tell a continuation from a new alert.
 *
 * <p>Format: {@code serverId-category-sourceType-sourceName}, with the vhost
 * inserted before the queue name for queue sources:
 * {@code serverId-category-queue-vhost-queueName}. Node and cluster keys
 * never carry a vhost. Hyphens and percent signs in the vhost and source
 * name are percent-encoded, so distinct (vhost, name) pairs never share a key.
 */
public final class AlertFingerprint {

    private AlertFingerprint() {
    }

    public static String of(String serverId, AlertCategory category, SourceType sourceType,
                            String sourceName, String vhost) {
        StringBuilder key = new StringBuilder()
                .append(serverId).append('-')
                .append(category.getValue()).append('-')
                .append(sourceType.getValue()).append('-');
        if (sourceType == SourceType.QUEUE && vhost != null && !vhost.isEmpty()) {
            key.append(escape(vhost)).append('-');
        }
        return key.append(escape(sourceName)).toString();
    }

    static String escape(String part) {
        if (part == null) {
            return null;
        }
        return part.replace("%", "%25").replace("-", "%2D");
    }
}
