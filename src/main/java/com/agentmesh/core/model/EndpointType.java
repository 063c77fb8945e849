package com.agentmesh.core.model;

/**
 * Kind of endpoint registered with the hub. The lower-case name is the prefix of every endpoint id.
 */
public enum EndpointType {
    INPUT,
    PROCESS,
    OUTPUT;

    public String prefix() {
        return name().toLowerCase();
    }

    /**
     * Builds the registry key for an endpoint of this type, e.g. {@code process.exec-1}.
     */
    public String endpointId(String id) {
        return prefix() + "." + id;
    }
}
