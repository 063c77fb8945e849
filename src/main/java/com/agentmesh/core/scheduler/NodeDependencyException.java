package com.agentmesh.core.scheduler;

import com.agentmesh.core.AgentMeshException;

import java.util.List;

/**
 * The task graph cannot be scheduled: duplicate or blank ids, unknown or self dependencies, or a cycle.
 */
public class NodeDependencyException extends AgentMeshException {

    private final List<String> nodeIds;

    public NodeDependencyException(String message, List<String> nodeIds) {
        super(message + ": " + nodeIds);
        this.nodeIds = List.copyOf(nodeIds);
    }

    public List<String> getNodeIds() {
        return nodeIds;
    }
}
