package com.agentmesh.core.engine;

import com.agentmesh.core.AgentMeshException;
import com.agentmesh.core.agent.AgentFleet;
import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.events.MeshEvent;
import com.agentmesh.core.hub.MessageHub;
import com.agentmesh.core.hub.ModuleRegistry;
import com.agentmesh.core.metrics.MeshMetrics;
import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.model.AgentStatus;
import com.agentmesh.core.model.NodeStatus;
import com.agentmesh.core.model.OrchestrationPhase;
import com.agentmesh.core.model.SubtaskSpec;
import com.agentmesh.core.model.TaskNode;
import com.agentmesh.core.parser.ProposalParser;
import com.agentmesh.core.pool.ResourcePool;
import com.agentmesh.core.scheduler.TaskGraphScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of {@link OrchestrationEngine} over a real hub, pool and agent fleet.
 */
class OrchestrationEngineTest {

    private MeshProperties properties;
    private ModuleRegistry registry;
    private MessageHub hub;
    private ResourcePool pool;
    private EventBus eventBus;
    private ScriptedAgentProvider provider;
    private RoundDispatcher dispatcher;
    private SimpleMeterRegistry meters;
    private List<MeshEvent> events;

    @BeforeEach
    void setUp() {
        properties = new MeshProperties();
        properties.getPool().setSweepIntervalSeconds(0);
        properties.getLoop().setMaxRounds(3);
        properties.getLoop().setThinkTimeoutSeconds(0);
        properties.getLoop().setActionTimeoutSeconds(0);
        meters = new SimpleMeterRegistry();
        events = new CopyOnWriteArrayList<>();
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        provider = new ScriptedAgentProvider();
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
        if (hub != null) {
            hub.close();
        }
    }

    private OrchestrationEngine engine(Decomposer decomposer, int maxRounds) {
        registry = new ModuleRegistry();
        hub = new MessageHub(registry, properties, null);
        pool = new ResourcePool(properties, null);
        new AgentFleet(pool, registry, new ProposalParser(), properties, eventBus, List.of(provider), null);
        dispatcher = new RoundDispatcher(hub, eventBus, 8);
        return new OrchestrationEngine(new TaskGraphScheduler(), pool, dispatcher, new RoleResolver(), eventBus,
                decomposer, new MeshMetrics(meters), maxRounds);
    }

    private OrchestrationEngine engine() {
        return engine(null, 10);
    }

    private static SubtaskSpec spec(String id, String description, String... deps) {
        return new SubtaskSpec(id, description, List.of(deps));
    }

    private static NodeStatus status(OrchestrationState state, String nodeId) {
        return state.node(nodeId).orElseThrow().status();
    }

    private List<String> eventTypes(String orchestrationId) {
        return events.stream()
                .filter(e -> orchestrationId.equals(e.orchestrationId()))
                .map(MeshEvent::eventType)
                .toList();
    }

    @Nested
    @DisplayName("rounds")
    class RoundTests {

        @Test
        @DisplayName("build then test: dependents become READY only after their prerequisite completes")
        void buildThenTest() {
            var engine = engine((task) -> List.of(spec("A", "build the app"), spec("B", "test the app", "A")), 10);

            var state = engine.start("build+test");
            assertEquals(OrchestrationPhase.PLANNING, state.phase());

            engine.runRound(state.id());
            assertEquals(1, state.round());
            assertEquals(NodeStatus.COMPLETED, status(state, "A"));
            assertEquals(NodeStatus.PENDING, status(state, "B"));
            assertEquals(OrchestrationPhase.REVIEWING, state.phase());

            engine.runRound(state.id());
            assertEquals(2, state.round());
            assertEquals(OrchestrationPhase.COMPLETED, state.phase());
            assertEquals(List.of("A", "B"), state.completedTasks());
            assertEquals("done test the app", state.node("B").orElseThrow().result());
        }

        @Test
        @DisplayName("dependency results are handed to dependents")
        void dependencyResultsForwarded() {
            var engine = engine();

            var state = engine.start("pipeline", List.of(spec("A", "build the app"), spec("B", "test the app", "A")));
            engine.run(state.id());

            var testTask = provider.tasks.stream().filter(t -> t.startsWith("test the app")).findFirst().orElseThrow();
            assertTrue(testTask.contains("Results of completed prerequisites:"));
            assertTrue(testTask.contains("- A: done build the app"));
        }

        @Test
        @DisplayName("independent nodes run in the same round")
        void independentNodesShareRound() {
            var engine = engine();

            var state = engine.start("fan out", List.of(spec("A", "build one"), spec("B", "build two"),
                    spec("C", "summarize results", "A", "B")));
            engine.run(state.id());

            assertEquals(OrchestrationPhase.COMPLETED, state.phase());
            assertEquals(2, state.round());
            assertEquals(AgentRole.SUMMARY, state.node("C").orElseThrow().role());
        }

        @Test
        @DisplayName("assigned agents return to IDLE after the round")
        void agentsReleased() {
            var engine = engine();

            var state = engine.start("one", List.of(spec("A", "build")));
            engine.run(state.id());

            assertFalse(pool.instances().isEmpty());
            assertTrue(pool.instances().stream().allMatch(i -> i.status() == AgentStatus.IDLE));
            assertNotNull(state.node("A").orElseThrow().assignee());
        }

        @Test
        @DisplayName("pool exhaustion leaves nodes READY for the next round")
        void poolExhaustion() {
            properties.getPool().setMaxInstances(Map.of("executor", 1));
            var engine = engine();

            var state = engine.start("two builds", List.of(spec("A", "build one"), spec("B", "build two")));
            engine.runRound(state.id());

            assertEquals(NodeStatus.COMPLETED, status(state, "A"));
            assertEquals(NodeStatus.READY, status(state, "B"));

            engine.run(state.id());
            assertEquals(OrchestrationPhase.COMPLETED, state.phase());
            assertEquals(2, state.round());
            assertEquals(1, pool.instances(AgentRole.EXECUTOR).size());
        }

        @Test
        @DisplayName("a configured allocation wait does not hold up the round")
        void allocationWaitIgnoredByRounds() {
            properties.getPool().setMaxInstances(Map.of("executor", 1));
            properties.getPool().setAllocationWaitMillis(2000);
            var engine = engine();

            var state = engine.start("two builds", List.of(spec("A", "build one"), spec("B", "build two")));
            long startMs = System.currentTimeMillis();
            engine.runRound(state.id());
            long elapsedMs = System.currentTimeMillis() - startMs;

            assertTrue(elapsedMs < 1500, "round took " + elapsedMs + "ms");
            assertEquals(NodeStatus.COMPLETED, status(state, "A"));
            assertEquals(NodeStatus.READY, status(state, "B"));
        }

        @Test
        @DisplayName("runRound on a terminal orchestration is a no-op")
        void terminalNoOp() {
            var engine = engine();
            var state = engine.start("one", List.of(spec("A", "build")));
            engine.run(state.id());

            engine.runRound(state.id());

            assertEquals(1, state.round());
        }
    }

    @Nested
    @DisplayName("failure handling")
    class FailureTests {

        @Test
        @DisplayName("a critical failure fails the orchestration at the end of the round")
        void criticalFailure() {
            var engine = engine();

            var state = engine.start("deploy", List.of(
                    new SubtaskSpec("A", "broken deploy", List.of(), null, true),
                    spec("B", "build docs")));
            engine.runRound(state.id());

            assertEquals(OrchestrationPhase.FAILED, state.phase());
            assertEquals("critical node failed: [A]", state.failureReason());
            assertEquals(List.of("A"), state.failedTasks());
            assertTrue(state.errors().get(0).startsWith("A: "));
            assertTrue(state.errors().get(0).contains("cannot do broken deploy"));
        }

        @Test
        @DisplayName("a failed prerequisite stalls its dependents instead of hanging")
        void stalledByFailure() {
            var engine = engine();

            var state = engine.start("chain", List.of(spec("A", "broken build"), spec("B", "test", "A")));
            engine.run(state.id());

            assertEquals(OrchestrationPhase.FAILED, state.phase());
            assertEquals("stalled: blocked by failed nodes [A]", state.failureReason());
            assertEquals(1, state.round());
            assertEquals(NodeStatus.PENDING, status(state, "B"));
        }

        @Test
        @DisplayName("failures remaining at the round limit fail the orchestration")
        void maxRounds() {
            var engine = engine(null, 1);

            var state = engine.start("mixed", List.of(spec("A", "broken build"), spec("B", "build docs")));
            engine.run(state.id());

            assertEquals(OrchestrationPhase.FAILED, state.phase());
            assertEquals("max rounds (1) reached with failed nodes [A]", state.failureReason());
            assertEquals(List.of("B"), state.completedTasks());
        }

        @Test
        @DisplayName("incomplete nodes at the round limit fail the orchestration")
        void maxRoundsIncomplete() {
            var engine = engine(null, 1);

            var state = engine.start("chain", List.of(spec("A", "build"), spec("B", "test", "A")));
            engine.run(state.id());

            assertEquals("max rounds (1) reached with incomplete nodes [B]", state.failureReason());
        }

        @Test
        @DisplayName("an exhausted agent loop fails only its node")
        void exhaustedLoop() {
            var engine = engine();

            var state = engine.start("search", List.of(spec("A", "endless build"), spec("B", "build docs")));
            engine.runRound(state.id());

            assertEquals(NodeStatus.FAILED, status(state, "A"));
            assertEquals(NodeStatus.COMPLETED, status(state, "B"));
            assertTrue(state.node("A").orElseThrow().error().startsWith("Loop stopped with EXHAUSTED after 3 iteration(s)"));
            assertFalse(state.isTerminal());
        }

        @Test
        @DisplayName("a cyclic graph is rejected at start")
        void invalidGraph() {
            var engine = engine();

            var state = engine.start("loop", List.of(spec("A", "build", "B"), spec("B", "test", "A")));

            assertEquals(OrchestrationPhase.FAILED, state.phase());
            assertTrue(state.failureReason().startsWith("invalid task graph: Cyclic dependencies"));
            assertTrue(state.nodes().isEmpty());
        }

        @Test
        @DisplayName("an empty decomposition fails")
        void emptyDecomposition() {
            var engine = engine(task -> List.of(), 10);

            var state = engine.start("nothing");

            assertEquals(OrchestrationPhase.FAILED, state.phase());
            assertEquals("decomposition produced no subtasks", state.failureReason());
        }

        @Test
        @DisplayName("a throwing decomposer fails the orchestration")
        void decomposerThrows() {
            var engine = engine(task -> {
                throw new IllegalStateException("planner down");
            }, 10);

            var state = engine.start("anything");

            assertEquals(OrchestrationPhase.FAILED, state.phase());
            assertEquals("decomposition failed: planner down", state.failureReason());
        }
    }

    @Nested
    @DisplayName("retryNode")
    class RetryTests {

        @Test
        @DisplayName("re-queues a failed node under a fresh id and rewires dependents")
        void retryRewires() {
            var engine = engine();
            var state = engine.start("flaky chain", List.of(spec("A", "flaky build"), spec("B", "test", "A")));
            engine.runRound(state.id());
            assertEquals(NodeStatus.FAILED, status(state, "A"));

            TaskNode retry = engine.retryNode(state.id(), "A");

            assertEquals("A.r1", retry.id());
            assertEquals("A.r1", state.node("A").orElseThrow().supersededBy());
            assertEquals(List.of("A.r1"), state.node("B").orElseThrow().dependsOn());

            engine.run(state.id());

            assertEquals(OrchestrationPhase.COMPLETED, state.phase());
            assertEquals(List.of("A.r1", "B"), state.completedTasks());
            assertEquals(List.of("A"), state.failedTasks());
            assertEquals(2, provider.attemptsFor("flaky build"));
        }

        @Test
        @DisplayName("retrying a retry increments the suffix")
        void retryOfRetry() {
            var engine = engine();
            var state = engine.start("broken", List.of(spec("A", "broken build"), spec("B", "build docs")));
            engine.runRound(state.id());

            engine.retryNode(state.id(), "A");
            engine.runRound(state.id());
            var second = engine.retryNode(state.id(), "A.r1");

            assertEquals("A.r2", second.id());
        }

        @Test
        @DisplayName("only active failed nodes can be retried")
        void rejectsInvalidRetry() {
            var engine = engine();
            var state = engine.start("one", List.of(spec("A", "broken build"), spec("B", "build docs")));
            engine.runRound(state.id());

            assertThrows(AgentMeshException.class, () -> engine.retryNode(state.id(), "B"));
            assertThrows(AgentMeshException.class, () -> engine.retryNode(state.id(), "ghost"));
            engine.retryNode(state.id(), "A");
            assertThrows(AgentMeshException.class, () -> engine.retryNode(state.id(), "A"));
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("without a decomposer the whole task becomes one node")
        void noDecomposer() {
            var engine = engine();

            var state = engine.execute("review the pull request");

            assertEquals(OrchestrationPhase.COMPLETED, state.phase());
            var node = state.node("task-1").orElseThrow();
            assertEquals(AgentRole.REVIEWER, node.role());
            assertEquals("done review the pull request", node.result());
        }

        @Test
        @DisplayName("cancel between rounds fails immediately")
        void cancelBetweenRounds() {
            var engine = engine();
            var state = engine.start("chain", List.of(spec("A", "build"), spec("B", "test", "A")));
            engine.runRound(state.id());

            assertTrue(engine.cancel(state.id()));

            assertEquals(OrchestrationPhase.FAILED, state.phase());
            assertEquals("cancelled", state.failureReason());
            assertFalse(engine.cancel(state.id()));
            engine.runRound(state.id());
            assertEquals(1, state.round());
        }

        @Test
        @DisplayName("ids follow ORCH-YYYY-NNNN and orchestrations are listed")
        void idsAndListing() {
            var engine = engine();

            var state = engine.start("one", List.of(spec("A", "build")));

            assertTrue(state.id().matches("ORCH-\\d{4}-\\d{4,}"));
            assertSame(state, engine.get(state.id()).orElseThrow());
            assertTrue(engine.list().contains(state));
            assertThrows(AgentMeshException.class, () -> engine.runRound("ORCH-0000-0000"));
        }

        @Test
        @DisplayName("publishes lifecycle events in order")
        void publishesEvents() {
            var engine = engine();

            var state = engine.start("one", List.of(spec("A", "build")));
            engine.run(state.id());

            assertEquals(List.of("orchestration.started", "orchestration.planned", "round.started",
                    "node.started", "node.completed", "round.completed", "orchestration.completed"),
                    eventTypes(state.id()));
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("agent.spawned")));
        }

        @Test
        @DisplayName("records orchestration metrics")
        void recordsMetrics() {
            var engine = engine();

            var state = engine.start("one", List.of(spec("A", "build")));
            engine.run(state.id());

            assertEquals(1.0, meters.find("agentmesh.orchestrations.total").tag("phase", "COMPLETED").counter().count());
            assertEquals(1.0, meters.find("agentmesh.orchestration.nodes").tag("result", "completed").counter().count());
            assertEquals(1, meters.find("agentmesh.orchestration.round.duration").timer().count());
        }
    }
}
