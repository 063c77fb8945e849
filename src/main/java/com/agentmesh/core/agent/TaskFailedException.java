package com.agentmesh.core.agent;

import com.agentmesh.core.AgentMeshException;
import com.agentmesh.core.react.LoopResult;

/**
 * Raised by an agent endpoint when its loop stopped unsuccessfully for a reason other than exhaustion.
 */
public class TaskFailedException extends AgentMeshException {

    private final LoopResult result;

    public TaskFailedException(LoopResult result) {
        super(result.reason() + ": " + result.error());
        this.result = result;
    }

    public LoopResult getResult() {
        return result;
    }
}
