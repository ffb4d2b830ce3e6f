package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertCategory;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.SourceType;
import com.example.rabbitwatch.exception.InvalidRequestException;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Filters and a page window for alert queries. Null fields don't filter.
 *
 * Filters apply in order severity, category, resolved, vhost. Results are
 * newest first, ties broken by identity key. {@code limit} null returns
 * everything from {@code offset} on.
 */
public record AlertFilter(AlertSeverity severity, AlertCategory category, Boolean resolved, String vhost,
                          Integer limit, Integer offset) {

    static final Comparator<Alert> NEWEST_FIRST = Comparator
            .comparing(Alert::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Alert::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public AlertFilter {
        if (limit != null && limit < 0) {
            throw new InvalidRequestException("limit must not be negative");
        }
        if (offset != null && offset < 0) {
            throw new InvalidRequestException("offset must not be negative");
        }
    }

    public static AlertFilter forVhost(String vhost) {
        return new AlertFilter(null, null, null, vhost, null, null);
    }

    /** Filtered and sorted, before pagination. */
    public List<Alert> matching(Collection<Alert> alerts) {
        Stream<Alert> stream = alerts.stream();
        if (severity != null) {
            stream = stream.filter(a -> a.getSeverity() == severity);
        }
        if (category != null) {
            stream = stream.filter(a -> a.getCategory() == category);
        }
        if (resolved != null) {
            stream = stream.filter(a -> a.isResolved() == resolved);
        }
        if (vhost != null) {
            stream = stream.filter(a -> inVhost(a, vhost));
        }
        return stream.sorted(NEWEST_FIRST).toList();
    }

    public List<Alert> page(List<Alert> matching) {
        int from = Math.min(offset != null ? offset : 0, matching.size());
        int to = limit != null ? (int) Math.min((long) from + limit, matching.size()) : matching.size();
        return matching.subList(from, to);
    }

    /** Queue alerts belong to one vhost; node and cluster alerts belong to every vhost. */
    static boolean inVhost(Alert alert, String vhost) {
        if (alert.getSource() == null || alert.getSource().type() != SourceType.QUEUE) {
            return true;
        }
        return vhost.equals(alert.getVhost());
    }
}
