package com.agentmesh.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Payload of the hub message that hands a task graph node to an agent endpoint.
 *
 * @param inputs results of the node's completed dependencies, keyed by node id
 */
public record TaskAssignment(
    String orchestrationId,
    String nodeId,
    String description,
    AgentRole role,
    String agentId,
    int round,
    Map<String, Object> inputs
) implements Serializable {

    public TaskAssignment {
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
    }
}
