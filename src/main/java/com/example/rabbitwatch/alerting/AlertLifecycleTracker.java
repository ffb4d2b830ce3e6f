package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.CandidateAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles one cycle's candidates against the alerts that were active
 * before it. Stateless: the caller owns the active and resolved collections.
 *
 * <ul>
 *   <li>a previously active alert whose key is missing from the candidates is resolved now</li>
 *   <li>a candidate matching an active key is a continuation and keeps its id and timestamp</li>
 *   <li>any other candidate is newly active with a fresh timestamp</li>
 * </ul>
 *
 * Several candidates may share a key in one cycle; the worst severity wins,
 * and on a tie the first one seen.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertLifecycleTracker {

    private final Clock clock;

    public ReconcileResult reconcile(Collection<CandidateAlert> candidates, Collection<Alert> previouslyActive) {
        Instant now = clock.instant();

        Map<String, CandidateAlert> byKey = new LinkedHashMap<>();
        for (CandidateAlert candidate : candidates) {
            byKey.merge(candidate.key(), candidate,
                    (kept, next) -> next.severity().isWorseThan(kept.severity()) ? next : kept);
        }

        Map<String, Alert> active = new LinkedHashMap<>();
        for (Alert alert : previouslyActive) {
            active.put(alert.getId(), alert);
        }

        List<Alert> stillActive = new ArrayList<>();
        List<Alert> newlyActive = new ArrayList<>();
        for (Map.Entry<String, CandidateAlert> entry : byKey.entrySet()) {
            CandidateAlert candidate = entry.getValue();
            Alert existing = active.get(entry.getKey());
            if (existing != null) {
                stillActive.add(existing.toBuilder()
                        .severity(candidate.severity())
                        .title(candidate.title())
                        .description(candidate.description())
                        .details(candidate.details())
                        .serverName(candidate.serverName())
                        .build());
            } else {
                newlyActive.add(toAlert(entry.getKey(), candidate, now));
            }
        }

        List<Alert> newlyResolved = new ArrayList<>();
        for (Alert alert : active.values()) {
            if (!byKey.containsKey(alert.getId())) {
                newlyResolved.add(alert.toBuilder()
                        .resolved(true)
                        .resolvedAt(now)
                        .build());
            }
        }

        if (!newlyActive.isEmpty() || !newlyResolved.isEmpty()) {
            log.debug("Reconciled {} candidates: {} continuing, {} new, {} resolved",
                    byKey.size(), stillActive.size(), newlyActive.size(), newlyResolved.size());
        }
        return new ReconcileResult(stillActive, newlyActive, newlyResolved);
    }

    private Alert toAlert(String key, CandidateAlert candidate, Instant now) {
        return Alert.builder()
                .id(key)
                .serverId(candidate.serverId())
                .serverName(candidate.serverName())
                .severity(candidate.severity())
                .category(candidate.category())
                .title(candidate.title())
                .description(candidate.description())
                .details(candidate.details())
                .timestamp(now)
                .resolved(false)
                .source(candidate.source())
                .vhost(candidate.vhost())
                .build();
    }

    /**
     * Outcome of one reconciliation. The next active set is
     * {@code stillActive} plus {@code newlyActive}.
     */
    public record ReconcileResult(List<Alert> stillActive, List<Alert> newlyActive, List<Alert> newlyResolved) {

        public ReconcileResult {
            stillActive = List.copyOf(stillActive);
            newlyActive = List.copyOf(newlyActive);
            newlyResolved = List.copyOf(newlyResolved);
        }

        public List<Alert> active() {
            List<Alert> all = new ArrayList<>(stillActive);
            all.addAll(newlyActive);
            return all;
        }

        public boolean hasTransitions() {
            return !newlyActive.isEmpty() || !newlyResolved.isEmpty();
        }
    }
}
