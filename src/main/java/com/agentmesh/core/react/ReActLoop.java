package com.agentmesh.core.react;

import com.agentmesh.core.metrics.MeshMetrics;
import com.agentmesh.core.model.ActionProposal;
import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.parser.ParseResult;
import com.agentmesh.core.parser.ProposalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Think, propose, act and observe until the agent completes, fails or runs out of iterations.
 * <p>
 * One loop belongs to one agent instance and runs strictly sequentially; a second concurrent
 * {@link #run} call is rejected. {@link #cancel()} takes effect at the next iteration boundary,
 * including a cancel issued before the run starts.
 * <p>
 * With a {@link ProposalReviewer} every parsed proposal is reviewed before it is acted on. A
 * rejection consumes the iteration, is recorded as its observation and counts towards the
 * rejection-streak and repeated-feedback limits of the {@link LoopConfig}.
 */
public class ReActLoop {

    private static final Logger log = LoggerFactory.getLogger(ReActLoop.class);

    static final String CORRECTION_TEMPLATE =
            "Your previous output could not be parsed as an action proposal (%s). "
            + "Reply with exactly one JSON object: {\"thought\": string, \"action\": string, \"params\": object}.";

    static final String REJECTION_PREFIX = "Rejected: ";

    /** Progress is reported at least this often while a call is pending. */
    static final Duration PROGRESS_INTERVAL = Duration.ofSeconds(10);

    private final String agentId;
    private final AgentRole role;
    private final AgentCapability agent;
    private final ActionRegistry actions;
    private final LoopConfig config;
    private final ProposalParser parser;
    private final ExecutorService timeoutExecutor;
    private final MeshMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile LoopState state = LoopState.IDLE;
    private volatile int iteration;
    private volatile ProposalReviewer reviewer;
    private volatile LoopProgressListener progressListener;
    private volatile Duration progressInterval = PROGRESS_INTERVAL;

    /**
     * @param timeoutExecutor runs think and action calls when a timeout is configured;
     *                        null runs them on the caller thread without a limit
     * @param metrics         nullable
     */
    public ReActLoop(String agentId, AgentRole role, AgentCapability agent, ActionRegistry actions,
                     LoopConfig config, ProposalParser parser, ExecutorService timeoutExecutor,
                     MeshMetrics metrics) {
        this.agentId = agentId;
        this.role = role;
        this.agent = Objects.requireNonNull(agent, "agent");
        this.actions = Objects.requireNonNull(actions, "actions");
        this.config = Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.timeoutExecutor = timeoutExecutor;
        this.metrics = metrics;
    }

    public ReActLoop(AgentCapability agent, ActionRegistry actions, LoopConfig config) {
        this(null, null, agent, actions, config, new ProposalParser(), null, null);
    }

    public LoopResult run(String task) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Loop for " + agentId + " is already running");
        }
        try {
            return runLoop(task);
        } finally {
            state = LoopState.STOPPED;
            cancelled.set(false);
            running.set(false);
        }
    }

    /**
     * @param reviewer null disables review
     */
    public void setReviewer(ProposalReviewer reviewer) {
        this.reviewer = reviewer;
    }

    public void setProgressListener(LoopProgressListener listener) {
        this.progressListener = listener;
    }

    void setProgressInterval(Duration interval) {
        this.progressInterval = interval;
    }

    /**
     * Requests a stop at the next iteration boundary. An in-flight think or action call is not interrupted.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public LoopState state() {
        return state;
    }

    private LoopResult runLoop(String task) {
        long startMs = System.currentTimeMillis();
        var run = new RunState(startMs);
        iteration = 0;
        enter(LoopState.IDLE);
        log.info("Loop started for {} [{}] (maxRounds={})", agentId, role, config.maxRounds());

        while (true) {
            if (cancelled.get()) {
                return run.stop(StopReason.CANCELLED, "cancelled");
            }
            if (run.iterations >= config.maxRounds()) {
                return run.stop(StopReason.EXHAUSTED, "reached " + config.maxRounds() + " iteration(s)");
            }
            int iteration = run.iterations + 1;
            this.iteration = iteration;

            // THINKING / PROPOSING, with corrective re-prompts on unparseable output
            ActionProposal proposal = null;
            int parseRetries = 0;
            while (proposal == null) {
                enter(LoopState.THINKING);
                run.rounds++;
                String raw;
                try {
                    List<TraceEntry> snapshot = List.copyOf(run.trace);
                    raw = withTimeout(() -> agent.think(task, snapshot), config.thinkTimeout());
                } catch (TimeoutException e) {
                    return run.stop(StopReason.EXHAUSTED, "think timed out after " + config.thinkTimeout().toSeconds() + "s");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return run.stop(StopReason.CANCELLED, "interrupted while thinking");
                } catch (Exception e) {
                    log.warn("Think failed for {} on iteration {}: {}", agentId, iteration, e.getMessage());
                    return run.stop(StopReason.FAILED, "think failed: " + e.getMessage());
                }
                run.trace.add(TraceEntry.of(iteration, TraceEntry.Kind.OUTPUT, raw == null ? "" : raw));

                enter(LoopState.PROPOSING);
                ParseResult parsed = parser.parse(raw);
                if (metrics != null) {
                    metrics.recordParse(parsed.success() ? parsed.method().name() : "FAILED");
                }
                if (parsed.success()) {
                    proposal = parsed.proposal();
                    continue;
                }
                run.trace.add(TraceEntry.of(iteration, TraceEntry.Kind.PARSE_ERROR, parsed.error()));
                if (parseRetries >= config.maxParseRetries()) {
                    log.warn("Giving up on unparseable output from {} after {} retries", agentId, parseRetries);
                    return run.stop(StopReason.PARSE_FAILURE, parsed.error());
                }
                parseRetries++;
                run.trace.add(TraceEntry.of(iteration, TraceEntry.Kind.CORRECTION,
                        String.format(CORRECTION_TEMPLATE, parsed.error())));
            }

            run.trace.add(TraceEntry.proposal(iteration, proposal));
            run.iterations = iteration;
            String action = proposal.action();
            log.debug("Iteration {} for {}: {} ({})", iteration, agentId, action, proposal.thought());

            var context = new ActionContext(agentId, role, task, iteration, run.trace);
            ProposalReviewer activeReviewer = reviewer;
            if (activeReviewer != null) {
                enter(LoopState.REVIEWING);
                ReviewVerdict verdict;
                var reviewed = proposal;
                try {
                    verdict = withTimeout(() -> activeReviewer.review(reviewed, context), config.thinkTimeout());
                } catch (TimeoutException e) {
                    return run.stop(StopReason.EXHAUSTED, "review timed out after " + config.thinkTimeout().toSeconds() + "s");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return run.stop(StopReason.CANCELLED, "interrupted while reviewing");
                } catch (Exception e) {
                    log.warn("Review failed for {} on iteration {}: {}", agentId, iteration, e.getMessage());
                    return run.stop(StopReason.FAILED, "review failed: " + e.getMessage());
                }
                if (verdict != null && !verdict.approved()) {
                    log.info("Proposal {} of {} rejected on iteration {}: {}", action, agentId, iteration, verdict.feedback());
                    run.reject(iteration, verdict.feedback());
                    if (config.maxRejections() > 0 && run.rejectionStreak >= config.maxRejections()) {
                        return run.stop(StopReason.REJECTED,
                                run.rejectionStreak + " consecutive proposal(s) rejected");
                    }
                    if (config.stuckThreshold() > 0 && run.sameFeedbackCount >= config.stuckThreshold()) {
                        return run.stop(StopReason.STUCK, "rejected " + run.sameFeedbackCount
                                + " time(s) in a row for: " + verdict.feedback());
                    }
                    continue;
                }
                run.approve();
            }

            boolean terminalAction = config.isComplete(action) || config.isFail(action);
            if (terminalAction && !actions.contains(action)) {
                run.observe(iteration, summarize(proposal));
            } else {
                enter(LoopState.EXECUTING);
                ActionResult result;
                var params = proposal.params();
                try {
                    result = withTimeout(() -> actions.execute(action, params, context), config.actionTimeout());
                } catch (ActionUnknownException e) {
                    result = ActionResult.failure(e.getMessage());
                } catch (TimeoutException e) {
                    return run.stop(StopReason.EXHAUSTED,
                            "action " + action + " timed out after " + config.actionTimeout().toSeconds() + "s");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return run.stop(StopReason.CANCELLED, "interrupted while executing " + action);
                } catch (Exception e) {
                    log.warn("Action {} failed for {}: {}", action, agentId, e.getMessage());
                    result = ActionResult.failure("Action " + action + " failed: " + e.getMessage());
                }
                enter(LoopState.OBSERVING);
                run.observe(iteration, result.observation());
            }

            if (config.isComplete(action)) {
                return run.stop(StopReason.COMPLETED, null);
            }
            if (config.isFail(action)) {
                return run.stop(StopReason.FAILED, "agent gave up: " + run.lastObservation);
            }
            if (run.isStalled(config.stallWindow())) {
                return run.stop(StopReason.STALLED,
                        "last " + config.stallWindow() + " observations were identical");
            }
        }
    }

    private void enter(LoopState next) {
        state = next;
        reportProgress();
    }

    private void reportProgress() {
        LoopProgressListener listener = progressListener;
        if (listener == null) {
            return;
        }
        try {
            listener.progress(state, iteration);
        } catch (Exception e) {
            log.warn("Progress listener of {} failed: {}", agentId, e.getMessage(), e);
        }
    }

    /**
     * Runs {@code call} on the timeout executor when one is set and either a timeout or a progress
     * listener is configured; otherwise inline. Progress is reported while waiting.
     */
    private <T> T withTimeout(Callable<T> call, Duration timeout) throws Exception {
        boolean limited = !timeout.isZero() && !timeout.isNegative();
        if (timeoutExecutor == null || (!limited && progressListener == null)) {
            return call.call();
        }
        Future<T> future = timeoutExecutor.submit(call);
        long deadline = limited ? System.nanoTime() + timeout.toNanos() : Long.MAX_VALUE;
        try {
            while (true) {
                long remaining = limited ? deadline - System.nanoTime() : Long.MAX_VALUE;
                if (remaining <= 0) {
                    throw new TimeoutException();
                }
                try {
                    return future.get(Math.min(remaining, progressInterval.toNanos()), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    reportProgress();
                }
            }
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String summarize(ActionProposal proposal) {
        for (String key : List.of("result", "summary", "reason", "output")) {
            Object value = proposal.params().get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return proposal.thought();
    }

    /**
     * Mutable bookkeeping of a single {@link #run} call.
     */
    private final class RunState {
        private final long startMs;
        private final List<TraceEntry> trace = new ArrayList<>();
        private final List<String> observations = new ArrayList<>();
        private int rounds;
        private int iterations;
        private String lastObservation;
        private int rejectionStreak;
        private int sameFeedbackCount;
        private String lastFeedback;

        RunState(long startMs) {
            this.startMs = startMs;
        }

        void observe(int iteration, String observation) {
            trace.add(TraceEntry.of(iteration, TraceEntry.Kind.OBSERVATION, observation));
            observations.add(observation);
            lastObservation = observation;
        }

        void reject(int iteration, String feedback) {
            iterations = iteration;
            String observation = REJECTION_PREFIX + feedback;
            trace.add(TraceEntry.of(iteration, TraceEntry.Kind.REJECTION, observation));
            lastObservation = observation;
            rejectionStreak++;
            sameFeedbackCount = feedback.equals(lastFeedback) ? sameFeedbackCount + 1 : 1;
            lastFeedback = feedback;
        }

        void approve() {
            rejectionStreak = 0;
            sameFeedbackCount = 0;
            lastFeedback = null;
        }

        boolean isStalled(int window) {
            if (window < 2 || observations.size() < window) {
                return false;
            }
            var recent = observations.subList(observations.size() - window, observations.size());
            return recent.stream().distinct().count() == 1;
        }

        LoopResult stop(StopReason reason, String error) {
            state = LoopState.STOPPED;
            long durationMs = System.currentTimeMillis() - startMs;
            var result = new LoopResult(reason.isSuccess(), reason, rounds, iterations, lastObservation,
                    trace, durationMs, reason.isSuccess() ? null : error);
            if (metrics != null) {
                metrics.recordLoopResult(reason.name(), iterations, durationMs);
            }
            if (reason.isSuccess()) {
                log.info("Loop completed for {} in {} iteration(s), {} round(s)", agentId, iterations, rounds);
            } else {
                log.warn("Loop for {} stopped with {} after {} iteration(s): {}", agentId, reason, iterations, error);
            }
            return result;
        }
    }
}
