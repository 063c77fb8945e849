package com.agentmesh.core.react;

import com.agentmesh.core.model.ActionProposal;

import java.time.Instant;

/**
 * One step recorded in a loop trace. The trace is handed back to the agent on every think call.
 *
 * @param iteration iteration the entry belongs to (1-based)
 * @param kind      what the entry records
 * @param content   raw output, diagnostic, corrective instruction or observation text
 * @param proposal  the parsed proposal for {@link Kind#PROPOSAL} entries, otherwise null
 * @param timestamp when the entry was recorded
 */
public record TraceEntry(int iteration, Kind kind, String content, ActionProposal proposal, Instant timestamp) {

    public enum Kind {
        /** Raw text returned by think. */
        OUTPUT,
        /** Parser diagnostic for an unparseable output. */
        PARSE_ERROR,
        /** Instruction asking the agent to correct its output format. */
        CORRECTION,
        /** A successfully parsed proposal. */
        PROPOSAL,
        /** Observation produced by executing the proposal. */
        OBSERVATION,
        /** Reviewer feedback on a proposal that was not executed. */
        REJECTION
    }

    static TraceEntry of(int iteration, Kind kind, String content) {
        return new TraceEntry(iteration, kind, content, null, Instant.now());
    }

    static TraceEntry proposal(int iteration, ActionProposal proposal) {
        return new TraceEntry(iteration, Kind.PROPOSAL, proposal.action(), proposal, Instant.now());
    }
}
