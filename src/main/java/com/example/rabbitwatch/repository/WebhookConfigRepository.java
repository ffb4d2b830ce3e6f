package com.example.rabbitwatch.repository;

import com.example.rabbitwatch.domain.WebhookConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WebhookConfigRepository extends JpaRepository<WebhookConfig, String> {

    List<WebhookConfig> findByWorkspaceId(String workspaceId);

    List<WebhookConfig> findByWorkspaceIdAndEnabled(String workspaceId, boolean enabled);

    Optional<WebhookConfig> findByIdAndWorkspaceId(String id, String workspaceId);
}
