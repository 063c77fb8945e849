package com.agentmesh.core.hub;

import com.agentmesh.core.AgentMeshException;
import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.metrics.MeshMetrics;
import com.agentmesh.core.model.EndpointType;
import com.agentmesh.core.model.HubMessage;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Routes {@link HubMessage}s to endpoints registered in the {@link ModuleRegistry}.
 * <p>
 * Targeted messages reach exactly one endpoint; untargeted messages fan out to every process and
 * output endpoint whose capabilities contain the message type. Deliveries to the same endpoint run
 * one at a time in arrival order. Handler exceptions are converted to failed {@link DeliveryResult}s
 * and never affect sibling recipients.
 */
@Service
public class MessageHub {

    private static final Logger log = LoggerFactory.getLogger(MessageHub.class);

    /** Subscribe with this endpoint id to observe every routed message. */
    public static final String ALL = "*";

    private final ModuleRegistry registry;
    private final MessageHistory history;
    private final MeshMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, EndpointLane> lanes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ListenerSubscription>> subscribers =
            new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Autowired
    public MessageHub(ModuleRegistry registry, MeshProperties properties,
                      @Autowired(required = false) MeshMetrics metrics) {
        this(registry, properties.getHub().getHistoryCapacity(), metrics, Clock.systemUTC());
    }

    MessageHub(ModuleRegistry registry, int historyCapacity, MeshMetrics metrics, Clock clock) {
        this.registry = registry;
        this.history = new MessageHistory(historyCapacity);
        this.metrics = metrics;
        this.clock = clock;
        var threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agentmesh-hub-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        registry.addListener(this::endpointsRemoved);
    }

    /**
     * Routes a message.
     * <p>
     * With {@code options.blocking()} the returned future is already complete. Otherwise it completes
     * once every recipient settled; cancelling it skips deliveries that have not started yet.
     *
     * @throws RoutingException if a targeted message cannot be resolved to exactly one endpoint
     */
    public CompletableFuture<SendResult> send(HubMessage message, SendOptions options) {
        HubMessage msg = message.id() == null ? message.withId(nextId()) : message;

        List<ModuleRegistry.RegisteredEndpoint> recipients = msg.isTargeted()
                ? List.of(registry.resolveTarget(msg.target()))
                : registry.resolveByCapability(msg.type());
        List<String> recipientIds = recipients.stream().map(ModuleRegistry.RegisteredEndpoint::endpointId).toList();

        history.add(new HistoryEntry(msg, recipientIds, clock.instant()));
        notifySubscribers(msg, recipientIds);
        if (metrics != null) {
            metrics.recordMessageRouted(msg.type(), recipientIds.size());
        }

        if (recipients.isEmpty()) {
            log.debug("Message {} of type {} has no recipients", msg.id(), msg.type());
            return CompletableFuture.completedFuture(SendResult.noRecipients(msg.id()));
        }
        log.debug("Routing message {} [{}] from {} to {}", msg.id(), msg.type(), msg.sender(), recipientIds);

        var deliveries = new ArrayList<CompletableFuture<DeliveryResult>>(recipients.size());
        for (var endpoint : recipients) {
            var lane = lanes.computeIfAbsent(endpoint.endpointId(), k -> new EndpointLane(executor));
            deliveries.add(lane.submit(() -> deliver(endpoint, msg, options.callback())));
        }

        CompletableFuture<SendResult> aggregate = CompletableFuture
                .allOf(deliveries.toArray(new CompletableFuture<?>[0]))
                .thenApply(v -> new SendResult(msg.id(), recipientIds,
                        deliveries.stream().map(CompletableFuture::join).toList()));
        aggregate.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                deliveries.forEach(d -> d.cancel(false));
            }
        });

        if (!options.blocking()) {
            return aggregate;
        }
        try {
            return CompletableFuture.completedFuture(aggregate.get());
        } catch (InterruptedException e) {
            aggregate.cancel(false);
            Thread.currentThread().interrupt();
            throw new AgentMeshException("Interrupted while waiting for delivery of message " + msg.id(), e);
        } catch (ExecutionException e) {
            throw new AgentMeshException("Delivery of message " + msg.id() + " failed", e.getCause());
        }
    }

    /**
     * Blocking send returning the aggregated result directly.
     */
    public SendResult sendAndWait(HubMessage message) {
        return send(message, SendOptions.blockingSend()).join();
    }

    /**
     * Runs an input endpoint's handler on a raw message and routes what it produces.
     * A handler returning a {@link HubMessage} replaces the message; any other return value passes the
     * original message through. The routed message is stamped with the input endpoint as sender.
     *
     * @param inputId full ({@code input.stdin}) or bare ({@code stdin}) input endpoint id
     */
    public CompletableFuture<SendResult> ingest(String inputId, HubMessage message, SendOptions options) {
        String endpointId = inputId.startsWith(EndpointType.INPUT.prefix())
                ? inputId : EndpointType.INPUT.endpointId(inputId);
        var endpoint = registry.find(endpointId)
                .orElseThrow(() -> new RoutingException("No input endpoint registered as " + inputId));

        Object produced;
        try {
            produced = endpoint.handler().handle(message);
        } catch (Exception e) {
            throw new AgentMeshException("Input endpoint " + endpointId + " rejected message: " + e.getMessage(), e);
        }
        HubMessage outbound = produced instanceof HubMessage hm ? hm : message;
        return send(outbound.withSender(endpointId), options);
    }

    public List<HistoryEntry> getHistory(HistoryFilter filter) {
        return history.list(filter == null ? HistoryFilter.all() : filter);
    }

    public List<HistoryEntry> getHistory() {
        return getHistory(HistoryFilter.all());
    }

    /**
     * Observes messages sent by, addressed to, or delivered to {@code endpointId}
     * ({@link #ALL} observes everything). Listeners run asynchronously; once
     * {@link Subscription#unsubscribe()} returns, no further notification reaches the listener.
     */
    public Subscription subscribe(String endpointId, MessageListener listener) {
        var subscription = new ListenerSubscription(endpointId, listener);
        subscribers.compute(endpointId, (k, subs) -> {
            var list = subs == null ? new CopyOnWriteArrayList<ListenerSubscription>() : subs;
            list.add(subscription);
            return list;
        });
        log.debug("Subscribed listener to {}", endpointId);
        return subscription;
    }

    public void unsubscribe(Subscription subscription) {
        subscription.unsubscribe();
    }

    public ModuleRegistry registry() {
        return registry;
    }

    int laneCount() {
        return lanes.size();
    }

    int subscribedEndpointCount() {
        return subscribers.size();
    }

    public boolean isRunning() {
        return !executor.isShutdown();
    }

    @PreDestroy
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Message hub stopped ({} messages in history)", history.size());
    }

    private DeliveryResult deliver(ModuleRegistry.RegisteredEndpoint endpoint, HubMessage msg,
                                   Consumer<DeliveryResult> callback) {
        long startMs = System.currentTimeMillis();
        DeliveryResult result;
        try {
            result = DeliveryResult.success(endpoint.endpointId(), endpoint.handler().handle(msg));
        } catch (Exception e) {
            log.warn("Handler {} failed on message {} [{}]: {}",
                    endpoint.endpointId(), msg.id(), msg.type(), e.getMessage());
            result = DeliveryResult.failure(endpoint.endpointId(), e);
        }
        if (metrics != null) {
            metrics.recordDelivery(result.success(), System.currentTimeMillis() - startMs);
        }
        if (callback != null) {
            try {
                callback.accept(result);
            } catch (Exception e) {
                log.warn("Delivery callback threw for message {}: {}", msg.id(), e.getMessage(), e);
            }
        }
        return result;
    }

    // queued deliveries of a removed lane still run; new sends cannot resolve the endpoint
    private void endpointsRemoved(String bundleName, List<String> endpointIds) {
        endpointIds.forEach(lanes::remove);
        log.debug("Dropped delivery lanes of bundle {}: {}", bundleName, endpointIds);
    }

    private void notifySubscribers(HubMessage msg, List<String> recipientIds) {
        if (subscribers.isEmpty()) {
            return;
        }
        Set<String> involved = new LinkedHashSet<>();
        involved.add(ALL);
        if (msg.sender() != null) involved.add(msg.sender());
        if (msg.target() != null) involved.add(msg.target());
        involved.addAll(recipientIds);

        var notified = new HashSet<ListenerSubscription>();
        for (String key : involved) {
            var subs = subscribers.get(key);
            if (subs == null) continue;
            for (var sub : subs) {
                if (notified.add(sub)) {
                    executor.execute(() -> sub.deliver(msg));
                }
            }
        }
    }

    private String nextId() {
        return "msg-" + sequence.incrementAndGet();
    }

    /**
     * Handle for cancelling a listener subscription.
     */
    public interface Subscription {
        void unsubscribe();

        boolean isActive();
    }

    private final class ListenerSubscription implements Subscription {

        private final String endpointId;
        private final MessageListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        ListenerSubscription(String endpointId, MessageListener listener) {
            this.endpointId = endpointId;
            this.listener = listener;
        }

        void deliver(HubMessage msg) {
            if (!active.get()) {
                return;
            }
            synchronized (this) {
                if (!active.get()) {
                    return;
                }
                try {
                    listener.onMessage(msg);
                } catch (Exception e) {
                    log.warn("Listener on {} threw processing message {}: {}",
                            endpointId, msg.id(), e.getMessage(), e);
                }
            }
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                subscribers.computeIfPresent(endpointId, (k, subs) -> {
                    subs.remove(this);
                    return subs.isEmpty() ? null : subs;
                });
            }
            // wait out an in-flight notification
            synchronized (this) {
                log.debug("Unsubscribed listener from {}", endpointId);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
