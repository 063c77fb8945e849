package com.agentmesh.core.engine;

import com.agentmesh.core.AgentMeshException;
import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.events.MeshEvent;
import com.agentmesh.core.logging.MdcContext;
import com.agentmesh.core.metrics.MeshMetrics;
import com.agentmesh.core.model.AgentInstance;
import com.agentmesh.core.model.NodeStatus;
import com.agentmesh.core.model.OrchestrationPhase;
import com.agentmesh.core.model.SubtaskSpec;
import com.agentmesh.core.model.TaskAssignment;
import com.agentmesh.core.model.TaskNode;
import com.agentmesh.core.pool.ResourcePool;
import com.agentmesh.core.scheduler.NodeDependencyException;
import com.agentmesh.core.scheduler.TaskGraphScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives orchestrations through their phases in discrete rounds.
 * <p>
 * {@link #start} decomposes the user task and validates the resulting graph. Each {@link #runRound}
 * promotes READY nodes, allocates an agent per READY node, dispatches the round concurrently
 * through the hub and records the outcomes. Failed nodes are never retried automatically;
 * {@link #retryNode} re-queues one explicitly under a fresh id.
 */
@Service
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);
    private static final AtomicInteger ORCHESTRATION_COUNTER = new AtomicInteger(0);

    private final TaskGraphScheduler scheduler;
    private final ResourcePool pool;
    private final RoundDispatcher dispatcher;
    private final RoleResolver roleResolver;
    private final EventBus eventBus;
    private final Decomposer decomposer;
    private final MeshMetrics metrics;
    private final int maxRounds;

    private final ConcurrentHashMap<String, OrchestrationState> orchestrations = new ConcurrentHashMap<>();

    @Autowired
    public OrchestrationEngine(TaskGraphScheduler scheduler, ResourcePool pool, RoundDispatcher dispatcher,
                               RoleResolver roleResolver, EventBus eventBus, MeshProperties properties,
                               @Autowired(required = false) Decomposer decomposer,
                               @Autowired(required = false) MeshMetrics metrics) {
        this(scheduler, pool, dispatcher, roleResolver, eventBus, decomposer, metrics,
                properties.getOrchestration().getMaxRounds());
    }

    OrchestrationEngine(TaskGraphScheduler scheduler, ResourcePool pool, RoundDispatcher dispatcher,
                        RoleResolver roleResolver, EventBus eventBus, Decomposer decomposer,
                        MeshMetrics metrics, int maxRounds) {
        this.scheduler = scheduler;
        this.pool = pool;
        this.dispatcher = dispatcher;
        this.roleResolver = roleResolver;
        this.eventBus = eventBus;
        this.decomposer = decomposer;
        this.metrics = metrics;
        this.maxRounds = maxRounds;
    }

    /**
     * Starts an orchestration using the configured {@link Decomposer}. Without one, the whole task
     * becomes a single node.
     */
    public OrchestrationState start(String userTask) {
        var state = create(userTask);
        try (var mdc = MdcContext.orchestration(state.id())) {
            List<SubtaskSpec> subtasks;
            try {
                subtasks = decomposer != null
                        ? decomposer.decompose(userTask)
                        : List.of(new SubtaskSpec("task-1", userTask, List.of()));
            } catch (Exception e) {
                log.error("Decomposition failed for {}: {}", state.id(), e.getMessage());
                state.addError("decomposition: " + e.getMessage());
                state.fail("decomposition failed: " + e.getMessage());
                finish(state);
                return state;
            }
            return plan(state, subtasks);
        }
    }

    /**
     * Starts an orchestration from an already decomposed task.
     */
    public OrchestrationState start(String userTask, List<SubtaskSpec> subtasks) {
        var state = create(userTask);
        try (var mdc = MdcContext.orchestration(state.id())) {
            return plan(state, subtasks);
        }
    }

    /**
     * Runs rounds until the orchestration is COMPLETED or FAILED.
     */
    public OrchestrationState run(String orchestrationId) {
        var state = require(orchestrationId);
        while (!state.isTerminal()) {
            runRound(orchestrationId);
        }
        return state;
    }

    public OrchestrationState execute(String userTask) {
        var state = start(userTask);
        return state.isTerminal() ? state : run(state.id());
    }

    /**
     * Runs one scheduling pass. A no-op on terminal orchestrations.
     */
    public OrchestrationState runRound(String orchestrationId) {
        var state = require(orchestrationId);
        state.roundLock.lock();
        try (var mdc = MdcContext.orchestration(orchestrationId)) {
            if (state.isTerminal()) {
                return state;
            }
            if (state.isCancelRequested()) {
                state.fail("cancelled");
                finish(state);
                return state;
            }
            state.transitionTo(OrchestrationPhase.EXECUTING);

            // 1. promote READY nodes; fail instead of spinning when nothing can ever run again
            boolean canProgress;
            synchronized (state) {
                scheduler.promoteReady(state.graph());
                canProgress = scheduler.canProgress(state.graph());
            }
            if (!canProgress) {
                List<String> blocking = failedIds(state);
                state.fail(blocking.isEmpty() ? "stalled" : "stalled: blocked by failed nodes " + blocking);
                finish(state);
                return state;
            }

            int round = state.nextRound();
            mdc.put(MdcContext.ROUND, round);
            long startMs = System.currentTimeMillis();
            eventBus.publish(MeshEvent.of("round.started", orchestrationId, null, Map.of("round", round)));

            // 2. allocate an agent per READY node; exhaustion leaves the node READY
            List<TaskAssignment> assignments = allocate(state, round);

            // 3. dispatch concurrently
            List<NodeOutcome> outcomes = dispatcher.dispatch(assignments);

            // 4. record outcomes and hand agents back
            boolean criticalFailure = false;
            for (NodeOutcome outcome : outcomes) {
                criticalFailure |= applyOutcome(state, outcome);
            }

            // 5. evaluate
            state.transitionTo(OrchestrationPhase.REVIEWING);
            synchronized (state) {
                if (scheduler.allCompleted(state.graph())) {
                    state.transitionTo(OrchestrationPhase.COMPLETED);
                } else if (criticalFailure) {
                    state.fail("critical node failed: " + failedIds(state));
                } else if (round >= maxRounds) {
                    List<String> failed = failedIds(state);
                    state.fail(failed.isEmpty()
                            ? "max rounds (" + maxRounds + ") reached with incomplete nodes " + incompleteIds(state)
                            : "max rounds (" + maxRounds + ") reached with failed nodes " + failed);
                }
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordRoundDuration(elapsedMs);
            }
            log.info("Round {} of {} finished in {}ms: {} dispatched, phase {}",
                    round, orchestrationId, elapsedMs, assignments.size(), state.phase());
            eventBus.publish(MeshEvent.of("round.completed", orchestrationId, null,
                    Map.of("round", round, "dispatched", assignments.size(), "phase", state.phase().name())));
            if (state.isTerminal()) {
                finish(state);
            }
            return state;
        } finally {
            state.roundLock.unlock();
        }
    }

    /**
     * Requests cancellation. Takes effect immediately between rounds, otherwise when the running
     * round finishes and the next one would start.
     *
     * @return false if the orchestration is unknown or already terminal
     */
    public boolean cancel(String orchestrationId) {
        var state = orchestrations.get(orchestrationId);
        if (state == null || state.isTerminal()) {
            return false;
        }
        state.requestCancel();
        if (state.roundLock.tryLock()) {
            try {
                if (!state.isTerminal()) {
                    state.fail("cancelled");
                    finish(state);
                }
            } finally {
                state.roundLock.unlock();
            }
        } else {
            log.info("Cancellation of {} requested; effective after the current round", orchestrationId);
        }
        return true;
    }

    /**
     * Re-queues a FAILED node as a new PENDING node {@code {id}.r{n}}. The failed node stays in the
     * graph, marked superseded, and PENDING dependents are rewired to the new node.
     *
     * @throws AgentMeshException if the orchestration is terminal or the node is not an active FAILED node
     */
    public TaskNode retryNode(String orchestrationId, String nodeId) {
        var state = require(orchestrationId);
        state.roundLock.lock();
        try {
            TaskNode retry;
            synchronized (state) {
                if (state.isTerminal()) {
                    throw new AgentMeshException("Orchestration " + orchestrationId + " is already " + state.phase());
                }
                var graph = state.graph();
                var failed = graph.get(nodeId);
                if (failed == null) {
                    throw new AgentMeshException("Unknown node " + nodeId + " in " + orchestrationId);
                }
                if (failed.status() != NodeStatus.FAILED || failed.isSuperseded()) {
                    throw new AgentMeshException("Node " + nodeId + " is " + failed.status()
                            + (failed.isSuperseded() ? " (superseded by " + failed.supersededBy() + ")" : "")
                            + "; only an active FAILED node can be retried");
                }
                String rootId = nodeId.replaceFirst("\\.r\\d+$", "");
                String retryId;
                do {
                    retryId = rootId + ".r" + state.nextRetry(rootId);
                } while (graph.containsKey(retryId));

                retry = TaskNode.pending(retryId, failed.description(), failed.dependsOn(), failed.role(),
                        failed.critical());
                graph.put(nodeId, failed.supersede(retryId));
                graph.put(retryId, retry);
                final String replacement = retryId;
                for (var node : List.copyOf(graph.values())) {
                    if (node.status() == NodeStatus.PENDING && node.dependsOn().contains(nodeId)) {
                        var rewired = node.dependsOn().stream()
                                .map(dep -> dep.equals(nodeId) ? replacement : dep)
                                .toList();
                        graph.put(node.id(), node.withDependsOn(rewired));
                    }
                }
            }
            log.info("Node {} of {} re-queued as {}", nodeId, orchestrationId, retry.id());
            eventBus.publish(MeshEvent.of("node.retried", orchestrationId, nodeId, Map.of("retryId", retry.id())));
            return retry;
        } finally {
            state.roundLock.unlock();
        }
    }

    public Optional<OrchestrationState> get(String orchestrationId) {
        return Optional.ofNullable(orchestrations.get(orchestrationId));
    }

    public List<OrchestrationState> list() {
        return List.copyOf(orchestrations.values());
    }

    /**
     * Generates a unique orchestration id in the format ORCH-YYYY-NNNN.
     */
    public String generateOrchestrationId() {
        int count = ORCHESTRATION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("ORCH-%d-%04d", year, count);
    }

    private OrchestrationState create(String userTask) {
        var state = new OrchestrationState(generateOrchestrationId(), userTask, Instant.now());
        orchestrations.put(state.id(), state);
        log.info("Starting orchestration {}: {}", state.id(), userTask);
        eventBus.publish(MeshEvent.of("orchestration.started", state.id(), null,
                Map.of("userTask", userTask == null ? "" : userTask)));
        return state;
    }

    private OrchestrationState plan(OrchestrationState state, List<SubtaskSpec> subtasks) {
        if (subtasks == null || subtasks.isEmpty()) {
            state.fail("decomposition produced no subtasks");
            finish(state);
            return state;
        }
        var nodes = subtasks.stream()
                .map(s -> TaskNode.pending(s.id(), s.description(), s.dependsOn(), roleResolver.resolve(s), s.critical()))
                .toList();
        try {
            scheduler.validate(nodes);
        } catch (NodeDependencyException e) {
            log.error("Rejected task graph for {}: {}", state.id(), e.getMessage());
            state.addError(e.getMessage());
            state.fail("invalid task graph: " + e.getMessage());
            finish(state);
            return state;
        }
        nodes.forEach(state::putNode);
        state.transitionTo(OrchestrationPhase.PLANNING);
        log.info("Planned {} node(s) for {}", nodes.size(), state.id());
        eventBus.publish(MeshEvent.of("orchestration.planned", state.id(), null, Map.of("nodes", nodes.size())));
        return state;
    }

    // the pool is called without holding the state monitor and never waits; exhaustion leaves the
    // node READY for the next round
    private List<TaskAssignment> allocate(OrchestrationState state, int round) {
        List<TaskNode> ready;
        synchronized (state) {
            var graph = state.graph();
            ready = scheduler.readyWave(graph, Integer.MAX_VALUE).stream().map(graph::get).toList();
        }
        var assignments = new ArrayList<TaskAssignment>();
        for (TaskNode node : ready) {
            Optional<AgentInstance> agent = pool.tryAllocate(node.role(), state.id() + "/" + node.id());
            if (agent.isEmpty()) {
                log.info("No {} agent for node {}; stays READY for next round", node.role(), node.id());
                continue;
            }
            String agentId = agent.get().id();
            synchronized (state) {
                var graph = state.graph();
                TaskNode current = graph.get(node.id());
                if (current == null || current.status() != NodeStatus.READY) {
                    pool.release(agentId);
                    continue;
                }
                graph.put(node.id(), current.inProgress(agentId));
                assignments.add(new TaskAssignment(state.id(), node.id(), current.description(), current.role(),
                        agentId, round, dependencyResults(current, graph)));
            }
        }
        return assignments;
    }

    /**
     * @return true if a critical node failed
     */
    private boolean applyOutcome(OrchestrationState state, NodeOutcome outcome) {
        TaskNode node;
        synchronized (state) {
            var graph = state.graph();
            node = graph.get(outcome.nodeId());
            if (outcome.success()) {
                graph.put(node.id(), node.completed(outcome.result()));
                state.recordCompleted(node.id());
            } else {
                String error = outcome.error() != null ? outcome.error() : "unknown error";
                graph.put(node.id(), node.failed(error));
                state.recordFailed(node.id(), error);
            }
        }
        pool.complete(outcome.agentId(), outcome.success());
        pool.release(outcome.agentId());
        if (metrics != null) {
            metrics.recordNodeResult(node.role().name(), outcome.success());
        }
        if (outcome.success()) {
            log.info("Node {} completed by {} in {}ms", node.id(), outcome.agentId(), outcome.elapsedMs());
            eventBus.publish(MeshEvent.of("node.completed", state.id(), node.id(),
                    Map.of("agentId", outcome.agentId(), "elapsedMs", outcome.elapsedMs())));
            return false;
        }
        log.warn("Node {} failed on {}: {}", node.id(), outcome.agentId(), outcome.error());
        eventBus.publish(MeshEvent.of("node.failed", state.id(), node.id(),
                Map.of("agentId", outcome.agentId(), "error", String.valueOf(outcome.error()),
                        "critical", node.critical())));
        return node.critical();
    }

    private void finish(OrchestrationState state) {
        if (metrics != null) {
            metrics.recordOrchestrationResult(state.phase().name(), state.round());
        }
        if (state.phase() == OrchestrationPhase.COMPLETED) {
            log.info("Orchestration {} completed after {} round(s)", state.id(), state.round());
            eventBus.publish(MeshEvent.of("orchestration.completed", state.id(), null,
                    Map.of("rounds", state.round(), "completedTasks", state.completedTasks())));
        } else {
            log.warn("Orchestration {} failed after {} round(s): {} (failed nodes: {})",
                    state.id(), state.round(), state.failureReason(), state.failedTasks());
            eventBus.publish(MeshEvent.of("orchestration.failed", state.id(), null,
                    Map.of("rounds", state.round(), "reason", String.valueOf(state.failureReason()),
                            "failedTasks", state.failedTasks(), "errors", state.errors())));
        }
    }

    private static Map<String, Object> dependencyResults(TaskNode node, Map<String, TaskNode> graph) {
        var inputs = new HashMap<String, Object>();
        for (String dep : node.dependsOn()) {
            var depNode = graph.get(dep);
            if (depNode != null && depNode.result() != null) {
                inputs.put(dep, depNode.result());
            }
        }
        return inputs;
    }

    private List<String> failedIds(OrchestrationState state) {
        synchronized (state) {
            return scheduler.failedNodes(state.graph()).stream().map(TaskNode::id).toList();
        }
    }

    private static List<String> incompleteIds(OrchestrationState state) {
        return state.nodes().stream()
                .filter(n -> !n.isSuperseded() && n.status() != NodeStatus.COMPLETED)
                .map(TaskNode::id)
                .toList();
    }

    private OrchestrationState require(String orchestrationId) {
        var state = orchestrations.get(orchestrationId);
        if (state == null) {
            throw new AgentMeshException("Unknown orchestration " + orchestrationId);
        }
        return state;
    }
}
