package com.example.rabbitwatch.repository;

import com.example.rabbitwatch.domain.RabbitServer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RabbitServerRepository extends JpaRepository<RabbitServer, String> {

    List<RabbitServer> findByEnabled(boolean enabled);

    List<RabbitServer> findByWorkspaceId(String workspaceId);

    Optional<RabbitServer> findByIdAndWorkspaceId(String id, String workspaceId);
}
