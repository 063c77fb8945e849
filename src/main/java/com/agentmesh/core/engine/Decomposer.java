package com.agentmesh.core.engine;

import com.agentmesh.core.model.SubtaskSpec;

import java.util.List;

/**
 * Splits a user task into subtasks with dependencies. Typically backed by a planning model.
 */
@FunctionalInterface
public interface Decomposer {

    List<SubtaskSpec> decompose(String userTask) throws Exception;
}
