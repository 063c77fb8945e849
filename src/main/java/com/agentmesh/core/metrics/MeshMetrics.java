package com.agentmesh.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for message routing, pooling and orchestration.
 */
@Service
public class MeshMetrics {

    private final MeterRegistry registry;

    public MeshMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Hub ---

    public void recordMessageRouted(String type, int recipients) {
        Counter.builder("agentmesh.hub.messages")
                .tag("type", type == null ? "none" : type)
                .tag("routed", recipients > 0 ? "yes" : "no")
                .register(registry)
                .increment();
    }

    public void recordDelivery(boolean success, long ms) {
        Timer.builder("agentmesh.hub.delivery.duration")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    // --- Pool ---

    public void recordAllocation(String role, String outcome) {
        Counter.builder("agentmesh.pool.allocations")
                .tag("role", role)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStaleInstance(String role) {
        Counter.builder("agentmesh.pool.stale_instances")
                .description("Instances marked ERROR after a missed heartbeat")
                .tag("role", role)
                .register(registry)
                .increment();
    }

    // --- Orchestration ---

    public void recordRoundDuration(long ms) {
        Timer.builder("agentmesh.orchestration.round.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordNodeResult(String role, boolean success) {
        Counter.builder("agentmesh.orchestration.nodes")
                .tag("role", role)
                .tag("result", success ? "completed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordOrchestrationResult(String phase, int rounds) {
        Counter.builder("agentmesh.orchestrations.total")
                .tag("phase", phase)
                .register(registry)
                .increment();
        DistributionSummary.builder("agentmesh.orchestration.rounds")
                .register(registry)
                .record(rounds);
    }

    // --- ReAct loop ---

    public void recordLoopResult(String reason, int iterations, long ms) {
        Counter.builder("agentmesh.loop.results")
                .tag("reason", reason)
                .register(registry)
                .increment();
        DistributionSummary.builder("agentmesh.loop.iterations")
                .register(registry)
                .record(iterations);
        Timer.builder("agentmesh.loop.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordParse(String method) {
        Counter.builder("agentmesh.parser.results")
                .tag("method", method)
                .register(registry)
                .increment();
    }
}
