package com.example.rabbitwatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A workspace's stored threshold overrides. Only bounds the workspace has
 * explicitly set are present; reads merge them over the defaults.
 */
@Entity
@Table(name = "workspace_alert_thresholds")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceAlertThresholds {

    @Id
    @Column(name = "workspace_id")
    private String workspaceId;

    @Convert(converter = ThresholdSetConverter.class)
    @Column(name = "thresholds", length = 4096)
    private ThresholdSet thresholds;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
