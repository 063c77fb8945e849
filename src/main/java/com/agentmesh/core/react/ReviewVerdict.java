package com.agentmesh.core.react;

/**
 * Outcome of a {@link ProposalReviewer}.
 *
 * @param approved whether the proposal may be executed
 * @param feedback reason for a rejection, shown to the agent on its next think call
 */
public record ReviewVerdict(boolean approved, String feedback) {

    public ReviewVerdict {
        feedback = feedback == null ? "" : feedback.trim();
    }

    public static ReviewVerdict approve() {
        return new ReviewVerdict(true, "");
    }

    public static ReviewVerdict reject(String feedback) {
        return new ReviewVerdict(false, feedback);
    }
}
