package com.agentmesh.core.react;

import java.util.List;

/**
 * Outcome of {@link ReActLoop#run}.
 *
 * @param success          true only for {@link StopReason#COMPLETED}
 * @param reason           why the loop stopped
 * @param rounds           think calls made, corrective re-prompts included
 * @param iterations       proposals acted on, complete and fail actions included
 * @param finalObservation last observation, or the completion summary
 * @param trace            full trace of the run
 * @param durationMs       wall-clock duration
 * @param error            failure detail (null on success)
 */
public record LoopResult(
    boolean success,
    StopReason reason,
    int rounds,
    int iterations,
    String finalObservation,
    List<TraceEntry> trace,
    long durationMs,
    String error
) {

    public LoopResult {
        trace = List.copyOf(trace);
    }
}
