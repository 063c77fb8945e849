package com.agentmesh.core.react;

import com.agentmesh.core.config.MeshProperties;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stop conditions and limits of one {@link ReActLoop}.
 *
 * @param maxRounds       maximum executed proposals before stopping with {@link StopReason#EXHAUSTED}
 * @param maxParseRetries corrective re-prompts allowed per iteration
 * @param completeActions actions that stop the loop successfully (case-insensitive)
 * @param failActions     actions that stop the loop as failed (case-insensitive)
 * @param thinkTimeout    limit per think call; zero disables
 * @param actionTimeout   limit per action execution; zero disables
 * @param stallWindow     stop after this many identical consecutive observations; below 2 disables
 * @param maxRejections   stop with {@link StopReason#REJECTED} after this many consecutive review
 *                        rejections; 0 disables
 * @param stuckThreshold  stop with {@link StopReason#STUCK} after this many consecutive rejections
 *                        with the same feedback; 0 disables
 */
public record LoopConfig(
    int maxRounds,
    int maxParseRetries,
    Set<String> completeActions,
    Set<String> failActions,
    Duration thinkTimeout,
    Duration actionTimeout,
    int stallWindow,
    int maxRejections,
    int stuckThreshold
) {

    public LoopConfig {
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
        }
        completeActions = normalize(completeActions);
        failActions = normalize(failActions);
        thinkTimeout = thinkTimeout == null ? Duration.ZERO : thinkTimeout;
        actionTimeout = actionTimeout == null ? Duration.ZERO : actionTimeout;
    }

    /** Without review limits. */
    public LoopConfig(int maxRounds, int maxParseRetries, Set<String> completeActions, Set<String> failActions,
                      Duration thinkTimeout, Duration actionTimeout, int stallWindow) {
        this(maxRounds, maxParseRetries, completeActions, failActions, thinkTimeout, actionTimeout, stallWindow, 0, 0);
    }

    public static LoopConfig defaults() {
        return from(new MeshProperties.Loop());
    }

    public static LoopConfig from(MeshProperties.Loop loop) {
        return new LoopConfig(
                loop.getMaxRounds(),
                loop.getMaxParseRetries(),
                Set.copyOf(loop.getCompleteActions()),
                Set.copyOf(loop.getFailActions()),
                Duration.ofSeconds(loop.getThinkTimeoutSeconds()),
                Duration.ofSeconds(loop.getActionTimeoutSeconds()),
                loop.getStallWindow(),
                loop.getMaxRejections(),
                loop.getStuckThreshold());
    }

    public LoopConfig withMaxRounds(int rounds) {
        return new LoopConfig(rounds, maxParseRetries, completeActions, failActions,
                thinkTimeout, actionTimeout, stallWindow, maxRejections, stuckThreshold);
    }

    public LoopConfig withTimeouts(Duration think, Duration action) {
        return new LoopConfig(maxRounds, maxParseRetries, completeActions, failActions, think, action,
                stallWindow, maxRejections, stuckThreshold);
    }

    public LoopConfig withStallWindow(int window) {
        return new LoopConfig(maxRounds, maxParseRetries, completeActions, failActions,
                thinkTimeout, actionTimeout, window, maxRejections, stuckThreshold);
    }

    public LoopConfig withReviewLimits(int rejections, int stuck) {
        return new LoopConfig(maxRounds, maxParseRetries, completeActions, failActions,
                thinkTimeout, actionTimeout, stallWindow, rejections, stuck);
    }

    public boolean isComplete(String action) {
        return action != null && completeActions.contains(action.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isFail(String action) {
        return action != null && failActions.contains(action.trim().toUpperCase(Locale.ROOT));
    }

    private static Set<String> normalize(Set<String> actions) {
        if (actions == null) {
            return Set.of();
        }
        return actions.stream()
                .map(a -> a.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
