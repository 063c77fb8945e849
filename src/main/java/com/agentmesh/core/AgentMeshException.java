package com.agentmesh.core;

/**
 * Root of the AgentMesh exception hierarchy.
 */
public class AgentMeshException extends RuntimeException {
    public AgentMeshException(String message) {
        super(message);
    }

    public AgentMeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
