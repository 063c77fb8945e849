package com.agentmesh.core.engine;

/**
 * Result of dispatching one task node to its agent.
 *
 * @param nodeId    node dispatched
 * @param agentId   instance that handled it
 * @param success   whether the agent reported success
 * @param result    handler return value on success (nullable)
 * @param error     failure detail (null on success)
 * @param elapsedMs dispatch wall-clock time
 */
public record NodeOutcome(String nodeId, String agentId, boolean success, Object result, String error,
                          long elapsedMs) {

    public static NodeOutcome success(String nodeId, String agentId, Object result, long elapsedMs) {
        return new NodeOutcome(nodeId, agentId, true, result, null, elapsedMs);
    }

    public static NodeOutcome failure(String nodeId, String agentId, String error, long elapsedMs) {
        return new NodeOutcome(nodeId, agentId, false, null, error, elapsedMs);
    }
}
