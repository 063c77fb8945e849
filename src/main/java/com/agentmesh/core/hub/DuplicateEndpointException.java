package com.agentmesh.core.hub;

import com.agentmesh.core.AgentMeshException;

/**
 * Thrown when a bundle declares an endpoint id owned by another active bundle,
 * or declares the same endpoint id twice.
 */
public class DuplicateEndpointException extends AgentMeshException {

    private final String endpointId;
    private final String ownerBundle;

    public DuplicateEndpointException(String endpointId, String ownerBundle) {
        super("Endpoint " + endpointId + " is already owned by bundle " + ownerBundle);
        this.endpointId = endpointId;
        this.ownerBundle = ownerBundle;
    }

    public String getEndpointId() {
        return endpointId;
    }

    public String getOwnerBundle() {
        return ownerBundle;
    }
}
