package com.agentmesh.core.react;

import java.util.Map;

/**
 * Executes one named action on behalf of an agent.
 */
@FunctionalInterface
public interface ActionHandler {

    ActionResult execute(Map<String, Object> params, ActionContext context) throws Exception;
}
