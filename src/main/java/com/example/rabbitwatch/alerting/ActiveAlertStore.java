package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.Alert;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory active alerts, keyed by workspace and server. A server's
 * alert list is replaced wholesale at the end of each detection cycle,
 * under that server's lock.
 */
@Component
public class ActiveAlertStore {

    private final Map<ServerKey, List<Alert>> alerts = new ConcurrentHashMap<>();
    private final Map<ServerKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public List<Alert> get(String workspaceId, String serverId) {
        return alerts.getOrDefault(new ServerKey(workspaceId, serverId), List.of());
    }

    public void replace(String workspaceId, String serverId, Collection<Alert> active) {
        ServerKey key = new ServerKey(workspaceId, serverId);
        if (active.isEmpty()) {
            alerts.remove(key);
        } else {
            alerts.put(key, List.copyOf(new ArrayList<>(active)));
        }
    }

    /** Drop everything held for a server, e.g. when it is deregistered. */
    public void clear(String workspaceId, String serverId) {
        ServerKey key = new ServerKey(workspaceId, serverId);
        alerts.remove(key);
        locks.remove(key);
    }

    public ReentrantLock lockFor(String workspaceId, String serverId) {
        return locks.computeIfAbsent(new ServerKey(workspaceId, serverId), k -> new ReentrantLock());
    }

    public int size() {
        return alerts.values().stream().mapToInt(List::size).sum();
    }

    private record ServerKey(String workspaceId, String serverId) {
    }
}
