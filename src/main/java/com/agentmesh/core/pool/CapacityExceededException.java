package com.agentmesh.core.pool;

import com.agentmesh.core.AgentMeshException;
import com.agentmesh.core.model.AgentRole;

/**
 * Thrown by {@link ResourcePool#spawn} when the role already has its maximum number of instances.
 */
public class CapacityExceededException extends AgentMeshException {

    private final AgentRole role;
    private final int capacity;

    public CapacityExceededException(AgentRole role, int capacity) {
        super("Capacity exceeded for role " + role + " (max " + capacity + ")");
        this.role = role;
        this.capacity = capacity;
    }

    public AgentRole getRole() {
        return role;
    }

    public int getCapacity() {
        return capacity;
    }
}
