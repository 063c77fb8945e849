package com.agentmesh.core.react;

import java.util.List;

/**
 * The reasoning side of an agent. Implementations are opaque to the loop: typically a model call
 * that turns the task and the trace so far into text containing one JSON action proposal.
 */
@FunctionalInterface
public interface AgentCapability {

    String think(String task, List<TraceEntry> trace) throws Exception;
}
