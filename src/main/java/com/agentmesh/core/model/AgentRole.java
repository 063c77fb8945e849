package com.agentmesh.core.model;

/**
 * Role of a pooled agent instance.
 */
public enum AgentRole {
    ORCHESTRATOR,
    EXECUTOR,
    REVIEWER,
    SEARCHER,
    SUMMARY;

    /**
     * Case-insensitive lookup; returns {@code null} for blank or unknown names.
     */
    public static AgentRole fromName(String name) {
        if (name == null || name.isBlank()) return null;
        for (AgentRole role : values()) {
            if (role.name().equalsIgnoreCase(name.trim())) {
                return role;
            }
        }
        return null;
    }
}
