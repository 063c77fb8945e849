package com.agentmesh.core.engine;

import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.events.MeshEvent;
import com.agentmesh.core.hub.DeliveryResult;
import com.agentmesh.core.hub.MessageHub;
import com.agentmesh.core.hub.SendResult;
import com.agentmesh.core.logging.MdcContext;
import com.agentmesh.core.model.EndpointType;
import com.agentmesh.core.model.HubMessage;
import com.agentmesh.core.model.TaskAssignment;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches the assignments of one round concurrently, each as a blocking targeted hub message to
 * the assignee's process endpoint. At most {@code maxParallel} dispatches are in flight at once.
 */
@Service
public class RoundDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RoundDispatcher.class);

    public static final String TASK_EXECUTE = "task.execute";
    public static final String SENDER = "orchestrator";

    private final MessageHub hub;
    private final EventBus eventBus;
    private final int maxParallel;
    private final ExecutorService executor;

    @Autowired
    public RoundDispatcher(MessageHub hub, EventBus eventBus, MeshProperties properties) {
        this(hub, eventBus, properties.getOrchestration().getMaxParallel());
    }

    RoundDispatcher(MessageHub hub, EventBus eventBus, int maxParallel) {
        this.hub = hub;
        this.eventBus = eventBus;
        this.maxParallel = Math.max(1, maxParallel);
        var threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agentmesh-dispatch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Dispatches every assignment and waits for all of them.
     *
     * @return outcomes in assignment order
     */
    public List<NodeOutcome> dispatch(List<TaskAssignment> assignments) {
        if (assignments.isEmpty()) {
            return List.of();
        }
        var semaphore = new Semaphore(maxParallel);
        var futures = new ArrayList<CompletableFuture<NodeOutcome>>(assignments.size());
        for (var assignment : assignments) {
            futures.add(CompletableFuture.supplyAsync(() -> dispatchOne(assignment, semaphore), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private NodeOutcome dispatchOne(TaskAssignment assignment, Semaphore semaphore) {
        String roleName = assignment.role().name();
        long startMs = System.currentTimeMillis();
        try (var mdc = MdcContext.node(assignment.orchestrationId(), assignment.nodeId(), roleName)) {
            semaphore.acquire();
            try {
                log.info("Dispatching node {} [{}] to {}: {}", assignment.nodeId(), roleName,
                        assignment.agentId(), assignment.description());
                eventBus.publish(MeshEvent.of("node.started", assignment.orchestrationId(), assignment.nodeId(),
                        Map.of("agentId", assignment.agentId(), "role", roleName, "round", assignment.round())));

                var message = HubMessage.targeted(SENDER, EndpointType.PROCESS.endpointId(assignment.agentId()),
                        TASK_EXECUTE, assignment);
                SendResult result = hub.sendAndWait(message);
                long elapsedMs = System.currentTimeMillis() - startMs;

                if (result.success()) {
                    return NodeOutcome.success(assignment.nodeId(), assignment.agentId(),
                            result.singleResult().orElse(null), elapsedMs);
                }
                String error = result.firstFailure().map(DeliveryResult::error).orElse("delivery failed");
                return NodeOutcome.failure(assignment.nodeId(), assignment.agentId(), error, elapsedMs);
            } finally {
                semaphore.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NodeOutcome.failure(assignment.nodeId(), assignment.agentId(),
                    "Interrupted: " + e.getMessage(), System.currentTimeMillis() - startMs);
        } catch (Exception e) {
            log.error("Infrastructure error dispatching node {}: {}", assignment.nodeId(), e.getMessage());
            return NodeOutcome.failure(assignment.nodeId(), assignment.agentId(), e.getMessage(),
                    System.currentTimeMillis() - startMs);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
