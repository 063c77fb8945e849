package com.agentmesh.core.hub;

import com.agentmesh.core.model.HubMessage;

import java.time.Instant;
import java.util.List;

/**
 * One message as recorded in the hub history together with its resolved recipients.
 */
public record HistoryEntry(HubMessage message, List<String> recipients, Instant timestamp) {

    public HistoryEntry {
        recipients = List.copyOf(recipients);
    }
}
