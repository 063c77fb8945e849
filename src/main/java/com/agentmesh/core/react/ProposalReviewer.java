package com.agentmesh.core.react;

import com.agentmesh.core.model.ActionProposal;

/**
 * Reviews a parsed proposal before the loop acts on it. A rejection is recorded as the iteration's
 * observation and the action is not executed.
 */
@FunctionalInterface
public interface ProposalReviewer {

    ReviewVerdict review(ActionProposal proposal, ActionContext context);
}
