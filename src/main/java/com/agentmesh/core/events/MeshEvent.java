package com.agentmesh.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted during orchestration.
 *
 * @param eventType       e.g. "orchestration.started", "round.completed", "node.failed", "agent.spawned"
 * @param orchestrationId orchestration the event belongs to (nullable for pool-level events)
 * @param nodeId          task node the event relates to (nullable)
 * @param payload         event details
 * @param timestamp       when the event occurred
 */
public record MeshEvent(
    String eventType,
    String orchestrationId,
    String nodeId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public MeshEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static MeshEvent of(String eventType, String orchestrationId, String nodeId, Map<String, Object> payload) {
        return new MeshEvent(eventType, orchestrationId, nodeId, payload, Instant.now());
    }
}
