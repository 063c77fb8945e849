package com.agentmesh.core.react;

import com.agentmesh.core.AgentMeshException;

/**
 * Raised by an agent endpoint when its loop ran out of iterations or hit a think or action timeout.
 */
public class LoopExhaustedException extends AgentMeshException {

    private final LoopResult result;

    public LoopExhaustedException(LoopResult result) {
        super("Loop stopped with " + result.reason() + " after " + result.iterations() + " iteration(s)"
                + (result.error() != null ? ": " + result.error() : ""));
        this.result = result;
    }

    public LoopResult getResult() {
        return result;
    }
}
