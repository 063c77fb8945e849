package com.agentmesh.core.parser;

/**
 * Which pass of the {@link ProposalParser} produced the proposal.
 */
public enum ParseMethod {
    /** A candidate parsed as strict JSON without modification. */
    MASKED,
    /** A candidate parsed after the repair chain rewrote it. */
    REPAIRED
}
