package com.agentmesh.core.react;

/**
 * Result of one action execution.
 *
 * @param success     whether the action achieved its effect
 * @param observation text fed back to the agent
 * @param data        optional structured output (nullable)
 */
public record ActionResult(boolean success, String observation, Object data) {

    public ActionResult {
        observation = observation == null ? "" : observation;
    }

    public static ActionResult success(String observation) {
        return new ActionResult(true, observation, null);
    }

    public static ActionResult success(String observation, Object data) {
        return new ActionResult(true, observation, data);
    }

    public static ActionResult failure(String observation) {
        return new ActionResult(false, observation, null);
    }
}
