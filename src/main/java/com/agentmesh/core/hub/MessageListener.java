package com.agentmesh.core.hub;

import com.agentmesh.core.model.HubMessage;

/**
 * Transient observer registered through {@link MessageHub#subscribe(String, MessageListener)}.
 */
@FunctionalInterface
public interface MessageListener {

    void onMessage(HubMessage message);
}
