package com.agentmesh.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A message routed by the hub.
 *
 * @param id       message id; assigned by the hub when null
 * @param type     routing type, matched against endpoint capabilities when {@code target} is absent
 * @param sender   endpoint id of the producer
 * @param receiver logical receiver, informational only
 * @param target   endpoint id (or bare id) that must receive the message; bypasses capability routing
 * @param payload  opaque payload handed to the handler
 * @param meta     free-form metadata
 */
public record HubMessage(
    String id,
    String type,
    String sender,
    String receiver,
    String target,
    Object payload,
    Map<String, Object> meta
) implements Serializable {

    public HubMessage {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static HubMessage targeted(String sender, String target, String type, Object payload) {
        return new HubMessage(null, type, sender, target, target, payload, Map.of());
    }

    public static HubMessage broadcast(String sender, String type, Object payload) {
        return new HubMessage(null, type, sender, null, null, payload, Map.of());
    }

    public boolean isTargeted() {
        return target != null && !target.isBlank();
    }

    public HubMessage withId(String newId) {
        return new HubMessage(newId, type, sender, receiver, target, payload, meta);
    }

    public HubMessage withSender(String newSender) {
        return new HubMessage(id, type, newSender, receiver, target, payload, meta);
    }
}
