package com.example.rabbitwatch.service;

import com.example.rabbitwatch.domain.Plan;
import com.example.rabbitwatch.domain.Subscription;
import com.example.rabbitwatch.domain.Workspace;
import com.example.rabbitwatch.exception.PermissionDeniedException;
import com.example.rabbitwatch.exception.ResourceNotFoundException;
import com.example.rabbitwatch.repository.SubscriptionRepository;
import com.example.rabbitwatch.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Plan and ownership lookups. A workspace's plan is its owner's plan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanService {

    private final SubscriptionRepository subscriptionRepository;
    private final WorkspaceRepository workspaceRepository;

    public Plan getUserPlan(String userId) {
        if (userId == null) {
            return Plan.FREE;
        }
        return subscriptionRepository.findById(userId)
                .map(Subscription::getPlan)
                .orElse(Plan.FREE);
    }

    public Plan getWorkspacePlan(String workspaceId) {
        return getUserPlan(requireWorkspace(workspaceId).getOwnerId());
    }

    public boolean canModifyThresholds(String workspaceId) {
        return getWorkspacePlan(workspaceId).canModifyThresholds();
    }

    public boolean isOwner(String workspaceId, String userId) {
        return userId != null && userId.equals(requireWorkspace(workspaceId).getOwnerId());
    }

    public void requireOwner(String workspaceId, String userId) {
        if (!isOwner(workspaceId, userId)) {
            log.warn("User {} attempted an owner-only change on workspace {}", userId, workspaceId);
            throw new PermissionDeniedException("Only the workspace owner can change these settings");
        }
    }

    public Workspace requireWorkspace(String workspaceId) {
        return workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new ResourceNotFoundException("Workspace", workspaceId));
    }
}
