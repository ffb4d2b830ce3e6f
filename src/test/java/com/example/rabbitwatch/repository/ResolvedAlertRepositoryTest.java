package com.example.rabbitwatch.repository;

import com.example.rabbitwatch.domain.AlertCategory;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.ResolvedAlertRecord;
import com.example.rabbitwatch.domain.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ResolvedAlertRepositoryTest {

    private static final Instant BASE = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private ResolvedAlertRepository repository;

    @BeforeEach
    void setUp() {
        repository.saveAll(List.of(
                record("n-mem", AlertSeverity.CRITICAL, AlertCategory.MEMORY, SourceType.NODE, null, 5),
                record("q-a", AlertSeverity.WARNING, AlertCategory.QUEUE, SourceType.QUEUE, "/", 4),
                record("q-b", AlertSeverity.CRITICAL, AlertCategory.QUEUE, SourceType.QUEUE, "billing", 3),
                record("q-c", AlertSeverity.INFO, AlertCategory.QUEUE, SourceType.QUEUE, "/", 2),
                onServer("srv-2", record("other", AlertSeverity.CRITICAL, AlertCategory.QUEUE, SourceType.QUEUE, "/", 1))));
    }

    private static ResolvedAlertRecord record(String key, AlertSeverity severity, AlertCategory category,
                                              SourceType sourceType, String vhost, int minutes) {
        return ResolvedAlertRecord.builder()
                .alertKey(key).workspaceId("ws-1").serverId("srv-1").serverName("prod")
                .severity(severity).category(category).title(key)
                .sourceType(sourceType).sourceName(key).vhost(vhost)
                .detectedAt(BASE.plusSeconds(minutes * 60L))
                .resolvedAt(BASE.plusSeconds(3600))
                .build();
    }

    private static ResolvedAlertRecord onServer(String serverId, ResolvedAlertRecord record) {
        record.setServerId(serverId);
        return record;
    }

    private static List<String> keys(Page<ResolvedAlertRecord> page) {
        return page.getContent().stream().map(ResolvedAlertRecord::getAlertKey).toList();
    }

    @Test
    void unfilteredIsNewestFirstForOneServer() {
        Page<ResolvedAlertRecord> page = repository.findFiltered("ws-1", "srv-1", null, null, null, Pageable.unpaged());

        assertEquals(List.of("n-mem", "q-a", "q-b", "q-c"), keys(page));
    }

    @Test
    void vhostNarrowsOnlyQueueAlerts() {
        Page<ResolvedAlertRecord> page = repository.findFiltered("ws-1", "srv-1", null, null, "/", Pageable.unpaged());

        assertEquals(List.of("n-mem", "q-a", "q-c"), keys(page));
    }

    @Test
    void windowKeepsTheFilteredTotal() {
        Page<ResolvedAlertRecord> page = repository.findFiltered("ws-1", "srv-1", null, AlertCategory.QUEUE, null,
                PageRequest.of(0, 2));

        assertEquals(List.of("q-a", "q-b"), keys(page));
        assertEquals(3, page.getTotalElements());
    }

    @Test
    void severityFilter() {
        Page<ResolvedAlertRecord> page = repository.findFiltered("ws-1", "srv-1", AlertSeverity.CRITICAL, null, null,
                Pageable.unpaged());

        assertEquals(List.of("n-mem", "q-b"), keys(page));
    }

    @Test
    void purgeRemovesOnlyOlderRecords() {
        ResolvedAlertRecord old = record("old", AlertSeverity.WARNING, AlertCategory.DISK, SourceType.NODE, null, 0);
        old.setResolvedAt(BASE.minusSeconds(86_400));
        repository.save(old);

        assertEquals(1, repository.deleteResolvedBefore(BASE));
        assertEquals(5, repository.count());
    }
}
