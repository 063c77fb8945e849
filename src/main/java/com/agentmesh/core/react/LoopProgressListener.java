package com.agentmesh.core.react;

/**
 * Liveness callback of a {@link ReActLoop}, invoked on the loop thread at every state change and
 * periodically while a think, review or action call is pending.
 */
@FunctionalInterface
public interface LoopProgressListener {

    void progress(LoopState state, int iteration);
}
