package com.agentmesh.core.parser;

import com.agentmesh.core.model.ActionProposal;

/**
 * Outcome of {@link ProposalParser#parse(String)}. Failures are values, never exceptions.
 *
 * @param success  whether a proposal was extracted
 * @param proposal the proposal (null on failure)
 * @param method   pass that produced the proposal (null on failure)
 * @param error    diagnostic naming each attempted pass (null on success)
 */
public record ParseResult(boolean success, ActionProposal proposal, ParseMethod method, String error) {

    public static ParseResult success(ActionProposal proposal, ParseMethod method) {
        return new ParseResult(true, proposal, method, null);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(false, null, null, error);
    }
}
