package com.example.rabbitwatch.repository;

import com.example.rabbitwatch.domain.SlackConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SlackConfigRepository extends JpaRepository<SlackConfig, String> {

    List<SlackConfig> findByWorkspaceId(String workspaceId);

    List<SlackConfig> findByWorkspaceIdAndEnabled(String workspaceId, boolean enabled);

    Optional<SlackConfig> findByIdAndWorkspaceId(String id, String workspaceId);
}
