package com.example.rabbitwatch.service;

import com.example.rabbitwatch.domain.MetricThreshold;
import com.example.rabbitwatch.domain.ThresholdMetric;
import com.example.rabbitwatch.domain.ThresholdSet;
import com.example.rabbitwatch.domain.WorkspaceAlertThresholds;
import com.example.rabbitwatch.exception.PermissionDeniedException;
import com.example.rabbitwatch.exception.ThresholdValidationException;
import com.example.rabbitwatch.repository.WorkspaceAlertThresholdsRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-workspace alert thresholds.
 *
 * Reads return the workspace's overrides laid over the defaults and never
 * fail. Updates are gated on the workspace plan, validated against the
 * merged result and written whole or not at all. Detection cycles read
 * through a short-lived cache; an update evicts the workspace's entry.
 */
@Slf4j
@Service
public class ThresholdService {

    private final WorkspaceAlertThresholdsRepository repository;
    private final PlanService planService;
    private final Clock clock;

    private final Cache<String, ThresholdSet> cache;
    private final Map<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    public ThresholdService(WorkspaceAlertThresholdsRepository repository, PlanService planService, Clock clock) {
        this.repository = repository;
        this.planService = planService;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .build();
    }

    public ThresholdSet getDefaults() {
        return ThresholdSet.defaults();
    }

    public ThresholdSet getThresholds(String workspaceId) {
        ThresholdSet cached = cache.getIfPresent(workspaceId);
        if (cached != null) {
            return cached.toBuilder().build();
        }
        try {
            ThresholdSet effective = getDefaults().mergedWith(loadOverrides(workspaceId).orElse(null));
            cache.put(workspaceId, effective);
            return effective.toBuilder().build();
        } catch (DataAccessException e) {
            log.warn("Could not load thresholds for workspace {}, using defaults: {}", workspaceId, e.getMessage());
            return getDefaults();
        }
    }

    /**
     * Apply a partial update. The plan check runs first; validation covers
     * the fully merged set so a bound can be checked against its stored or
     * default partner.
     *
     * @return the effective thresholds after the update
     */
    public ThresholdSet updateThresholds(String workspaceId, ThresholdSet partial) {
        if (!planService.canModifyThresholds(workspaceId)) {
            throw new PermissionDeniedException("Your plan does not allow modifying alert thresholds");
        }
        if (partial == null || partial.isEmpty()) {
            throw new ThresholdValidationException(List.of("thresholds"), List.of("thresholds: no values supplied"));
        }

        ReentrantLock lock = writeLocks.computeIfAbsent(workspaceId, id -> new ReentrantLock());
        lock.lock();
        try {
            ThresholdSet stored = loadOverrides(workspaceId).orElseGet(ThresholdSet::new);
            ThresholdSet overrides = stored.mergedWith(partial);
            ThresholdSet effective = getDefaults().mergedWith(overrides);

            List<String> violations = validate(effective);
            if (!violations.isEmpty()) {
                throw new ThresholdValidationException(metricNames(violations), violations);
            }

            repository.save(WorkspaceAlertThresholds.builder()
                    .workspaceId(workspaceId)
                    .thresholds(overrides)
                    .updatedAt(clock.instant())
                    .build());
            cache.invalidate(workspaceId);
            log.info("Updated alert thresholds for workspace {}", workspaceId);
            return effective;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check every metric of a complete set. Each violation message starts
     * with the metric's name followed by a colon.
     */
    public static List<String> validate(ThresholdSet set) {
        List<String> violations = new ArrayList<>();
        for (ThresholdMetric metric : ThresholdMetric.values()) {
            MetricThreshold bounds = set.get(metric);
            if (bounds == null) {
                continue;
            }
            String name = metric.getKey();
            Double warning = bounds.warning();
            Double critical = bounds.critical();

            if (!metric.hasCritical() && critical != null) {
                violations.add(name + ": has no critical bound");
                critical = null;
            }
            if (!inRange(metric, warning)) {
                violations.add(name + ": warning " + warning + " is out of range " + range(metric));
            }
            if (!inRange(metric, critical)) {
                violations.add(name + ": critical " + critical + " is out of range " + range(metric));
            }
            if (warning != null && critical != null && Double.isFinite(warning) && Double.isFinite(critical)
                    && !metric.isOrdered(warning, critical)) {
                violations.add(name + ": critical " + critical + " must be "
                        + (metric.getDirection() == ThresholdMetric.Direction.LOWER_IS_WORSE ? "below" : "above")
                        + " warning " + warning);
            }
        }
        return violations;
    }

    private Optional<ThresholdSet> loadOverrides(String workspaceId) {
        return repository.findById(workspaceId).map(WorkspaceAlertThresholds::getThresholds);
    }

    private static boolean inRange(ThresholdMetric metric, Double value) {
        if (value == null) {
            return true;
        }
        if (!Double.isFinite(value) || value < 0) {
            return false;
        }
        return !metric.isPercentage() || value <= 100;
    }

    private static String range(ThresholdMetric metric) {
        return metric.isPercentage() ? "[0, 100]" : "[0, +inf)";
    }

    private static List<String> metricNames(List<String> violations) {
        Set<String> names = new LinkedHashSet<>();
        for (String violation : violations) {
            names.add(violation.substring(0, violation.indexOf(':')));
        }
        return new ArrayList<>(names);
    }
}
