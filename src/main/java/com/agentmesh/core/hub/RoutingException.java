package com.agentmesh.core.hub;

import com.agentmesh.core.AgentMeshException;

/**
 * Thrown when a targeted message cannot be resolved to exactly one endpoint.
 */
public class RoutingException extends AgentMeshException {
    public RoutingException(String message) {
        super(message);
    }
}
