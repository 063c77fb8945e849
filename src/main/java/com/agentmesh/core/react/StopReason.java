package com.agentmesh.core.react;

/**
 * Why a {@link ReActLoop} stopped. Only {@link #COMPLETED} is a success.
 */
public enum StopReason {
    /** The agent proposed a complete action. */
    COMPLETED,
    /** The agent proposed a fail action, or thinking itself failed. */
    FAILED,
    /** Iteration limit reached, or a think or action call timed out. */
    EXHAUSTED,
    /** Output could not be parsed within the allowed retries. */
    PARSE_FAILURE,
    /** The last observations were identical for the configured window. */
    STALLED,
    /** The reviewer rejected the configured number of consecutive proposals. */
    REJECTED,
    /** The reviewer rejected consecutive proposals for the same reason the configured number of times. */
    STUCK,
    /** Cancelled between iterations. */
    CANCELLED;

    public boolean isSuccess() {
        return this == COMPLETED;
    }
}
