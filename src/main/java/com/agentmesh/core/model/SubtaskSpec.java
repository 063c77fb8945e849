package com.agentmesh.core.model;

import java.util.List;

/**
 * One entry returned by the decomposition capability.
 *
 * @param id          subtask id
 * @param description subtask description
 * @param dependsOn   ids of prerequisite subtasks
 * @param role        optional role hint (nullable)
 * @param critical    whether a failure should fail the whole orchestration
 */
public record SubtaskSpec(
    String id,
    String description,
    List<String> dependsOn,
    AgentRole role,
    boolean critical
) {

    public SubtaskSpec {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public SubtaskSpec(String id, String description, List<String> dependsOn) {
        this(id, description, dependsOn, null, false);
    }
}
