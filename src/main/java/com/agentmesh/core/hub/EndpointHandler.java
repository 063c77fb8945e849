package com.agentmesh.core.hub;

import com.agentmesh.core.model.HubMessage;

/**
 * Handler contract implemented by every input, process and output endpoint.
 * <p>
 * The hub invokes handlers on its dispatch executor; an exception thrown here is converted
 * into a failed {@link DeliveryResult} and never reaches sibling recipients.
 */
@FunctionalInterface
public interface EndpointHandler {

    Object handle(HubMessage message) throws Exception;
}
