package com.agentmesh.core.model;

/**
 * Lifecycle status of a pooled agent instance.
 */
public enum AgentStatus {
    IDLE,
    RUNNING,
    SUCCESS,
    ERROR
}
