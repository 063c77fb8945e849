package com.agentmesh.core.react;

import com.agentmesh.core.AgentMeshException;

import java.util.Collection;

/**
 * Thrown by {@link ActionRegistry#execute} for an action with no registered handler.
 * The loop turns it into a failure observation.
 */
public class ActionUnknownException extends AgentMeshException {

    private final String action;

    public ActionUnknownException(String action, Collection<String> known) {
        super("Unknown action '" + action + "'; available actions: " + known);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
