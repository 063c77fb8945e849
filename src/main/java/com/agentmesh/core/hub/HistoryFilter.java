package com.agentmesh.core.hub;

/**
 * Filter for {@link MessageHub#getHistory(HistoryFilter)}. Null fields match everything.
 *
 * @param endpointId matches sender, receiver, target or any resolved recipient
 * @param type       matches the message type
 */
public record HistoryFilter(String endpointId, String type) {

    public static HistoryFilter all() {
        return new HistoryFilter(null, null);
    }

    public static HistoryFilter byEndpoint(String endpointId) {
        return new HistoryFilter(endpointId, null);
    }

    public static HistoryFilter byType(String type) {
        return new HistoryFilter(null, type);
    }

    public boolean matches(HistoryEntry entry) {
        var msg = entry.message();
        if (type != null && !type.equals(msg.type())) {
            return false;
        }
        if (endpointId == null) {
            return true;
        }
        return endpointId.equals(msg.sender())
                || endpointId.equals(msg.receiver())
                || endpointId.equals(msg.target())
                || entry.recipients().contains(endpointId);
    }
}
