package com.agentmesh.core.engine;

import com.agentmesh.core.model.OrchestrationPhase;
import com.agentmesh.core.model.TaskNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one orchestration, owned and mutated by the {@link OrchestrationEngine}.
 * Readers get copies; all access is synchronized on the instance.
 */
public final class OrchestrationState {

    private final String id;
    private final String userTask;
    private final Instant createdAt;

    private OrchestrationPhase phase = OrchestrationPhase.UNDERSTANDING;
    private final Map<String, TaskNode> graph = new LinkedHashMap<>();
    private final List<String> completedTasks = new ArrayList<>();
    private final List<String> failedTasks = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final Map<String, Integer> retryCounts = new HashMap<>();
    private int round;
    private String failureReason;
    private boolean cancelRequested;

    /** Held for the duration of a round, so rounds of one orchestration never overlap. */
    final ReentrantLock roundLock = new ReentrantLock();

    OrchestrationState(String id, String userTask, Instant createdAt) {
        this.id = id;
        this.userTask = userTask;
        this.createdAt = createdAt;
    }

    public String id() {
        return id;
    }

    public String userTask() {
        return userTask;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized OrchestrationPhase phase() {
        return phase;
    }

    public synchronized boolean isTerminal() {
        return phase.isTerminal();
    }

    public synchronized int round() {
        return round;
    }

    public synchronized List<TaskNode> nodes() {
        return List.copyOf(graph.values());
    }

    public synchronized Optional<TaskNode> node(String nodeId) {
        return Optional.ofNullable(graph.get(nodeId));
    }

    public synchronized List<String> completedTasks() {
        return List.copyOf(completedTasks);
    }

    public synchronized List<String> failedTasks() {
        return List.copyOf(failedTasks);
    }

    public synchronized List<String> errors() {
        return List.copyOf(errors);
    }

    public synchronized String failureReason() {
        return failureReason;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    @Override
    public synchronized String toString() {
        return "Orchestration[" + id + ", " + phase + ", round " + round + ", "
                + completedTasks.size() + "/" + graph.size() + " completed, "
                + failedTasks.size() + " failed]";
    }

    // --- engine-side mutation ---

    /**
     * Live graph; callers must hold this instance's monitor.
     */
    Map<String, TaskNode> graph() {
        return graph;
    }

    synchronized void transitionTo(OrchestrationPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Orchestration " + id + " cannot move from " + phase + " to " + next);
        }
        phase = next;
    }

    synchronized void fail(String reason) {
        if (phase.isTerminal()) {
            return;
        }
        phase = OrchestrationPhase.FAILED;
        failureReason = reason;
    }

    synchronized void putNode(TaskNode node) {
        graph.put(node.id(), node);
    }

    synchronized void recordCompleted(String nodeId) {
        completedTasks.add(nodeId);
    }

    synchronized void recordFailed(String nodeId, String error) {
        failedTasks.add(nodeId);
        errors.add(nodeId + ": " + error);
    }

    synchronized void addError(String error) {
        errors.add(error);
    }

    synchronized int nextRound() {
        return ++round;
    }

    synchronized void requestCancel() {
        cancelRequested = true;
    }

    synchronized int nextRetry(String nodeId) {
        return retryCounts.merge(nodeId, 1, Integer::sum);
    }
}
