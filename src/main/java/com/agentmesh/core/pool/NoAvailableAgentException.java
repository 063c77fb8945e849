package com.agentmesh.core.pool;

import com.agentmesh.core.AgentMeshException;
import com.agentmesh.core.model.AgentRole;

/**
 * Thrown by {@link ResourcePool#allocate} when no instance of the role is idle and the role is at capacity.
 */
public class NoAvailableAgentException extends AgentMeshException {

    private final AgentRole role;

    public NoAvailableAgentException(AgentRole role, String detail) {
        super("No available agent for role " + role + ": " + detail);
        this.role = role;
    }

    public AgentRole getRole() {
        return role;
    }
}
