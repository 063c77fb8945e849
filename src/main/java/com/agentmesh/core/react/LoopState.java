package com.agentmesh.core.react;

/**
 * Position of a {@link ReActLoop} within one iteration.
 */
public enum LoopState {
    IDLE,
    THINKING,
    PROPOSING,
    REVIEWING,
    EXECUTING,
    OBSERVING,
    STOPPED
}
