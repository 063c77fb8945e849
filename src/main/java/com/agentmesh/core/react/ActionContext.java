package com.agentmesh.core.react;

import com.agentmesh.core.model.AgentRole;

import java.util.List;

/**
 * What an action handler may know about the loop invoking it.
 */
public record ActionContext(
    String agentId,
    AgentRole role,
    String task,
    int iteration,
    List<TraceEntry> trace
) {

    public ActionContext {
        trace = trace == null ? List.of() : List.copyOf(trace);
    }
}
