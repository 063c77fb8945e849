package com.agentmesh.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A node in the orchestration task graph.
 *
 * @param id           node id, unique within the graph
 * @param description  what the node should accomplish
 * @param dependsOn    ids of nodes that must be COMPLETED first
 * @param role         role hint for assignment (nullable, inferred from the description when absent)
 * @param critical     a failure of a critical node fails the whole orchestration immediately
 * @param status       current status
 * @param assignee     agent instance id once IN_PROGRESS
 * @param result       result recorded on completion
 * @param error        last error recorded on failure
 * @param supersededBy id of the retry node that replaced this failed node (nullable)
 */
public record TaskNode(
    String id,
    String description,
    List<String> dependsOn,
    AgentRole role,
    boolean critical,
    NodeStatus status,
    String assignee,
    Object result,
    String error,
    String supersededBy
) implements Serializable {

    public TaskNode {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static TaskNode pending(String id, String description, List<String> dependsOn,
                                   AgentRole role, boolean critical) {
        return new TaskNode(id, description, dependsOn, role, critical, NodeStatus.PENDING,
                null, null, null, null);
    }

    public TaskNode ready() {
        return transition(NodeStatus.READY, assignee, result, error);
    }

    public TaskNode inProgress(String agentId) {
        return transition(NodeStatus.IN_PROGRESS, agentId, result, error);
    }

    public TaskNode completed(Object value) {
        return transition(NodeStatus.COMPLETED, assignee, value, null);
    }

    public TaskNode failed(String reason) {
        return transition(NodeStatus.FAILED, assignee, result, reason);
    }

    public TaskNode supersede(String retryId) {
        return new TaskNode(id, description, dependsOn, role, critical, status, assignee, result, error, retryId);
    }

    public TaskNode withDependsOn(List<String> newDeps) {
        return new TaskNode(id, description, newDeps, role, critical, status, assignee, result, error, supersededBy);
    }

    public boolean isSuperseded() {
        return supersededBy != null;
    }

    private TaskNode transition(NodeStatus next, String newAssignee, Object newResult, String newError) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Node " + id + " cannot move from " + status + " to " + next);
        }
        return new TaskNode(id, description, dependsOn, role, critical, next, newAssignee, newResult, newError,
                supersededBy);
    }
}
