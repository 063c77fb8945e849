package com.agentmesh.core.scheduler;

import com.agentmesh.core.model.NodeStatus;
import com.agentmesh.core.model.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency bookkeeping for orchestration task graphs: validation, READY promotion and
 * progress detection. Graphs are insertion-ordered maps of node id to node.
 */
@Service
public class TaskGraphScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphScheduler.class);

    /**
     * Rejects graphs that could never fully reach READY.
     *
     * @throws NodeDependencyException on blank or duplicate ids, unknown or self dependencies, or cycles
     */
    public void validate(List<TaskNode> nodes) {
        var ids = new HashSet<String>();
        var duplicates = new ArrayList<String>();
        for (var node : nodes) {
            if (node.id() == null || node.id().isBlank()) {
                throw new NodeDependencyException("Task graph contains a node without id",
                        List.of(String.valueOf(node.description())));
            }
            if (!ids.add(node.id())) {
                duplicates.add(node.id());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new NodeDependencyException("Duplicate node ids", duplicates);
        }

        for (var node : nodes) {
            for (var dep : node.dependsOn()) {
                if (dep.equals(node.id())) {
                    throw new NodeDependencyException("Node depends on itself", List.of(node.id()));
                }
                if (!ids.contains(dep)) {
                    throw new NodeDependencyException("Node " + node.id() + " depends on unknown node", List.of(dep));
                }
            }
        }

        // Kahn's algorithm: whatever never reaches in-degree zero sits on or behind a cycle
        var inDegree = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        for (var node : nodes) {
            inDegree.put(node.id(), node.dependsOn().size());
            for (var dep : node.dependsOn()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id());
            }
        }
        var queue = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });
        int visited = 0;
        while (!queue.isEmpty()) {
            String id = queue.poll();
            visited++;
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }
        if (visited < nodes.size()) {
            var cyclic = nodes.stream()
                    .map(TaskNode::id)
                    .filter(id -> inDegree.get(id) > 0)
                    .toList();
            throw new NodeDependencyException("Cyclic dependencies", cyclic);
        }
        log.debug("Validated task graph with {} node(s)", nodes.size());
    }

    /**
     * Flips every PENDING node whose dependencies are all COMPLETED to READY.
     *
     * @return ids promoted in this call, in graph order
     */
    public List<String> promoteReady(Map<String, TaskNode> graph) {
        var promoted = new ArrayList<String>();
        for (var node : List.copyOf(graph.values())) {
            if (node.status() == NodeStatus.PENDING && dependenciesCompleted(node, graph)) {
                graph.put(node.id(), node.ready());
                promoted.add(node.id());
            }
        }
        if (!promoted.isEmpty()) {
            log.info("Promoted to READY: {}", promoted);
        }
        return promoted;
    }

    /**
     * READY node ids in graph order, at most {@code limit}.
     */
    public List<String> readyWave(Map<String, TaskNode> graph, int limit) {
        return graph.values().stream()
                .filter(n -> n.status() == NodeStatus.READY)
                .map(TaskNode::id)
                .limit(Math.max(limit, 0))
                .toList();
    }

    public boolean dependenciesCompleted(TaskNode node, Map<String, TaskNode> graph) {
        for (var dep : node.dependsOn()) {
            var depNode = graph.get(dep);
            if (depNode == null || depNode.status() != NodeStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when every node that has not been superseded by a retry is COMPLETED.
     */
    public boolean allCompleted(Map<String, TaskNode> graph) {
        return graph.values().stream()
                .filter(n -> !n.isSuperseded())
                .allMatch(n -> n.status() == NodeStatus.COMPLETED);
    }

    /**
     * True when some node is READY or IN_PROGRESS, or some PENDING node can still become READY,
     * meaning none of its transitive dependencies has FAILED.
     */
    public boolean canProgress(Map<String, TaskNode> graph) {
        var memo = new HashMap<String, Boolean>();
        for (var node : graph.values()) {
            switch (node.status()) {
                case READY, IN_PROGRESS -> {
                    return true;
                }
                case PENDING -> {
                    if (isReachable(node, graph, memo, new HashSet<>())) {
                        return true;
                    }
                }
                default -> {
                }
            }
        }
        return false;
    }

    /**
     * Active (not superseded) FAILED nodes.
     */
    public List<TaskNode> failedNodes(Map<String, TaskNode> graph) {
        return graph.values().stream()
                .filter(n -> n.status() == NodeStatus.FAILED && !n.isSuperseded())
                .toList();
    }

    private boolean isReachable(TaskNode node, Map<String, TaskNode> graph,
                                Map<String, Boolean> memo, Set<String> path) {
        Boolean known = memo.get(node.id());
        if (known != null) {
            return known;
        }
        if (!path.add(node.id())) {
            return false;
        }
        boolean reachable = switch (node.status()) {
            case COMPLETED, READY, IN_PROGRESS -> true;
            case FAILED -> false;
            case PENDING -> node.dependsOn().stream().allMatch(dep -> {
                var depNode = graph.get(dep);
                return depNode != null && isReachable(depNode, graph, memo, path);
            });
        };
        path.remove(node.id());
        memo.put(node.id(), reachable);
        return reachable;
    }
}
