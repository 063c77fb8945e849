package com.agentmesh.core.model;

/**
 * Phase of an orchestration. Phases only move forward, except that EXECUTING and REVIEWING
 * may alternate across rounds.
 */
public enum OrchestrationPhase {
    UNDERSTANDING,
    PLANNING,
    EXECUTING,
    REVIEWING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(OrchestrationPhase next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case UNDERSTANDING -> next == PLANNING;
            case PLANNING -> next == EXECUTING;
            case EXECUTING -> next == REVIEWING;
            case REVIEWING -> next == EXECUTING || next == COMPLETED;
            case COMPLETED, FAILED -> false;
        };
    }
}
