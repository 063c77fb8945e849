package com.agentmesh.core.model;

/**
 * Status of a task graph node. Transitions only move forward:
 * PENDING → READY → IN_PROGRESS → COMPLETED | FAILED.
 */
public enum NodeStatus {
    PENDING,
    READY,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(NodeStatus next) {
        return switch (this) {
            case PENDING -> next == READY;
            case READY -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
