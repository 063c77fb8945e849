package com.agentmesh.core.model;

import java.util.Map;

/**
 * The parsed intent of one ReAct iteration.
 *
 * @param thought         the agent's reasoning
 * @param action          action name looked up in the action registry
 * @param params          action parameters (never null)
 * @param expectedOutcome optional expected outcome stated by the agent
 * @param risk            optional risk note stated by the agent
 */
public record ActionProposal(
    String thought,
    String action,
    Map<String, Object> params,
    String expectedOutcome,
    String risk
) {

    public ActionProposal {
        thought = thought == null ? "" : thought;
        params = params == null ? Map.of() : params;
    }

    public ActionProposal(String thought, String action, Map<String, Object> params) {
        this(thought, action, params, null, null);
    }
}
