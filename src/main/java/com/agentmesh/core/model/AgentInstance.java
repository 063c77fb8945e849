package com.agentmesh.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Resource pool record for one agent instance. Immutable; the pool swaps records on every transition.
 *
 * @param id            generated instance id (e.g. "executor-3f9a2c1b")
 * @param role          role the instance was spawned for
 * @param providerId    provider that backs the instance
 * @param status        current lifecycle status
 * @param createdAt     spawn time
 * @param lastHeartbeat last heartbeat received
 * @param idleSince     when the instance last became idle, used for oldest-idle-first allocation
 * @param currentTaskId task the instance is working on (nullable)
 * @param errorCount    number of times the instance ended in {@link AgentStatus#ERROR}
 */
public record AgentInstance(
    String id,
    AgentRole role,
    String providerId,
    AgentStatus status,
    Instant createdAt,
    Instant lastHeartbeat,
    Instant idleSince,
    String currentTaskId,
    int errorCount
) implements Serializable {

    public AgentInstance withStatus(AgentStatus newStatus) {
        return new AgentInstance(id, role, providerId, newStatus, createdAt, lastHeartbeat, idleSince,
                currentTaskId, newStatus == AgentStatus.ERROR ? errorCount + 1 : errorCount);
    }

    public AgentInstance running(String taskId) {
        return new AgentInstance(id, role, providerId, AgentStatus.RUNNING, createdAt, lastHeartbeat, idleSince,
                taskId, errorCount);
    }

    public AgentInstance idle(Instant now) {
        return new AgentInstance(id, role, providerId, AgentStatus.IDLE, createdAt, now, now, null, errorCount);
    }

    public AgentInstance heartbeat(Instant now) {
        return new AgentInstance(id, role, providerId, status, createdAt, now, idleSince, currentTaskId, errorCount);
    }
}
