package com.example.rabbitwatch.repository;

import com.example.rabbitwatch.domain.WorkspaceAlertThresholds;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WorkspaceAlertThresholdsRepository extends JpaRepository<WorkspaceAlertThresholds, String> {
}
