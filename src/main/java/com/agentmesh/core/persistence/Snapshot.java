package com.agentmesh.core.persistence;

import com.agentmesh.core.model.EndpointRef;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Flat registry record written for crash recovery.
 *
 * @param entries registered endpoints
 * @param routes  capability to endpoint ids
 * @param savedAt when the snapshot was taken
 */
public record Snapshot(List<EndpointRef> entries, Map<String, List<String>> routes, Instant savedAt) {

    public Snapshot {
        entries = entries == null ? List.of() : List.copyOf(entries);
        routes = routes == null ? Map.of() : Map.copyOf(routes);
    }

    /**
     * Same entries and routes, ignoring {@link #savedAt()}.
     */
    public boolean sameContent(Snapshot other) {
        return other != null && entries.equals(other.entries) && routes.equals(other.routes);
    }
}
