package com.agentmesh.core.agent;

import com.agentmesh.core.model.AgentInstance;
import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.react.ActionRegistry;
import com.agentmesh.core.react.AgentCapability;
import com.agentmesh.core.react.ProposalReviewer;

/**
 * Supplies the reasoning capability and the actions for pooled agent instances.
 * Register implementations as Spring beans; the {@link AgentFleet} picks one per spawned instance.
 */
public interface AgentProvider {

    String id();

    boolean supports(AgentRole role);

    AgentCapability createAgent(AgentInstance instance);

    ActionRegistry createActions(AgentInstance instance);

    /**
     * Reviewer consulted before each action of the instance's loop; null (the default) acts on every
     * proposal unreviewed.
     */
    default ProposalReviewer createReviewer(AgentInstance instance) {
        return null;
    }
}
