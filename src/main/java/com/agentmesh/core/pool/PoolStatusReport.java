package com.agentmesh.core.pool;

import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.model.AgentStatus;

import java.util.Map;

/**
 * Point-in-time counts of pooled instances.
 */
public record PoolStatusReport(
    int total,
    Map<AgentStatus, Integer> byStatus,
    Map<AgentRole, Integer> byRole,
    Map<AgentRole, Integer> capacity
) {

    public PoolStatusReport {
        byStatus = Map.copyOf(byStatus);
        byRole = Map.copyOf(byRole);
        capacity = Map.copyOf(capacity);
    }

    public int count(AgentStatus status) {
        return byStatus.getOrDefault(status, 0);
    }

    public int count(AgentRole role) {
        return byRole.getOrDefault(role, 0);
    }
}
