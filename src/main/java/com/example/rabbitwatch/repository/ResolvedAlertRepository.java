package com.example.rabbitwatch.repository;

import com.example.rabbitwatch.domain.AlertCategory;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.ResolvedAlertRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ResolvedAlertRepository extends JpaRepository<ResolvedAlertRecord, String> {

    /**
     * Resolved alerts of one server, newest first. A vhost only narrows
     * queue alerts; node and cluster alerts match every vhost.
     */
    @Query(value = "SELECT r FROM ResolvedAlertRecord r WHERE " +
           "r.workspaceId = :workspaceId AND r.serverId = :serverId AND " +
           "(:severity IS NULL OR r.severity = :severity) AND " +
           "(:category IS NULL OR r.category = :category) AND " +
           "(:vhost IS NULL OR r.sourceType IS NULL " +
           "OR r.sourceType <> com.example.rabbitwatch.domain.SourceType.QUEUE OR r.vhost = :vhost) " +
           "ORDER BY r.detectedAt DESC, r.alertKey ASC",
           countQuery = "SELECT COUNT(r) FROM ResolvedAlertRecord r WHERE " +
           "r.workspaceId = :workspaceId AND r.serverId = :serverId AND " +
           "(:severity IS NULL OR r.severity = :severity) AND " +
           "(:category IS NULL OR r.category = :category) AND " +
           "(:vhost IS NULL OR r.sourceType IS NULL " +
           "OR r.sourceType <> com.example.rabbitwatch.domain.SourceType.QUEUE OR r.vhost = :vhost)")
    Page<ResolvedAlertRecord> findFiltered(@Param("workspaceId") String workspaceId,
                                           @Param("serverId") String serverId,
                                           @Param("severity") AlertSeverity severity,
                                           @Param("category") AlertCategory category,
                                           @Param("vhost") String vhost,
                                           Pageable pageable);

    @Transactional
    @Modifying
    @Query("DELETE FROM ResolvedAlertRecord r WHERE r.resolvedAt < :cutoff")
    int deleteResolvedBefore(@Param("cutoff") Instant cutoff);
}
