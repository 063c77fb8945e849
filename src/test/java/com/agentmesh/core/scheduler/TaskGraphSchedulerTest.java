package com.agentmesh.core.scheduler;

import com.agentmesh.core.model.NodeStatus;
import com.agentmesh.core.model.TaskNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphSchedulerTest {

    private final TaskGraphScheduler scheduler = new TaskGraphScheduler();

    private static TaskNode node(String id, String... deps) {
        return TaskNode.pending(id, "do " + id, List.of(deps), null, false);
    }

    private static Map<String, TaskNode> graph(TaskNode... nodes) {
        var graph = new LinkedHashMap<String, TaskNode>();
        for (var n : nodes) {
            graph.put(n.id(), n);
        }
        return graph;
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("accepts a DAG")
        void acceptsDag() {
            assertDoesNotThrow(() -> scheduler.validate(List.of(node("A"), node("B", "A"), node("C", "A", "B"))));
        }

        @Test
        @DisplayName("rejects cycles and names the nodes on them")
        void rejectsCycle() {
            var ex = assertThrows(NodeDependencyException.class,
                    () -> scheduler.validate(List.of(node("A", "C"), node("B", "A"), node("C", "B"), node("D"))));

            assertEquals(List.of("A", "B", "C"), ex.getNodeIds());
            assertTrue(ex.getMessage().startsWith("Cyclic dependencies"));
        }

        @Test
        @DisplayName("rejects unknown dependencies")
        void rejectsUnknown() {
            var ex = assertThrows(NodeDependencyException.class,
                    () -> scheduler.validate(List.of(node("A", "ghost"))));
            assertEquals(List.of("ghost"), ex.getNodeIds());
        }

        @Test
        @DisplayName("rejects duplicate ids and self dependencies")
        void rejectsDuplicatesAndSelf() {
            var dup = assertThrows(NodeDependencyException.class,
                    () -> scheduler.validate(List.of(node("A"), node("A"))));
            assertEquals(List.of("A"), dup.getNodeIds());

            assertThrows(NodeDependencyException.class, () -> scheduler.validate(List.of(node("A", "A"))));
        }

        @Test
        @DisplayName("rejects blank ids")
        void rejectsBlank() {
            assertThrows(NodeDependencyException.class, () -> scheduler.validate(List.of(node(" "))));
        }
    }

    @Nested
    @DisplayName("promoteReady")
    class PromoteReadyTests {

        @Test
        @DisplayName("only nodes with completed dependencies become READY")
        void buildThenTest() {
            var g = graph(node("A"), node("B", "A"));

            assertEquals(List.of("A"), scheduler.promoteReady(g));
            assertEquals(NodeStatus.PENDING, g.get("B").status());

            g.put("A", g.get("A").inProgress("executor-1").completed("built"));

            assertEquals(List.of("B"), scheduler.promoteReady(g));
            assertEquals(NodeStatus.READY, g.get("B").status());
        }

        @Test
        @DisplayName("promotion is idempotent")
        void idempotent() {
            var g = graph(node("A"));
            scheduler.promoteReady(g);

            assertTrue(scheduler.promoteReady(g).isEmpty());
            assertEquals(List.of("A"), scheduler.readyWave(g, 10));
            assertTrue(scheduler.readyWave(g, 0).isEmpty());
        }
    }

    @Nested
    @DisplayName("progress")
    class ProgressTests {

        @Test
        @DisplayName("a failed dependency makes dependents unreachable")
        void failedDependencyBlocks() {
            var g = graph(node("A"), node("B", "A"), node("C", "B"));
            g.put("A", g.get("A").ready().inProgress("x").failed("boom"));

            assertFalse(scheduler.canProgress(g));
            assertEquals(List.of("A"), scheduler.failedNodes(g).stream().map(TaskNode::id).toList());
        }

        @Test
        @DisplayName("an independent pending branch keeps the graph alive")
        void independentBranch() {
            var g = graph(node("A"), node("B", "A"), node("C"));
            g.put("A", g.get("A").ready().inProgress("x").failed("boom"));

            assertTrue(scheduler.canProgress(g));
        }

        @Test
        @DisplayName("superseded nodes are ignored for completion")
        void supersededIgnored() {
            var g = graph(node("A"));
            g.put("A", g.get("A").ready().inProgress("x").failed("boom").supersede("A.r1"));
            g.put("A.r1", node("A.r1").ready().inProgress("y").completed("ok"));

            assertTrue(scheduler.allCompleted(g));
            assertTrue(scheduler.failedNodes(g).isEmpty());
        }
    }
}
