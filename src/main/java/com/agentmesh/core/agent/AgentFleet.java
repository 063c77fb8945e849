package com.agentmesh.core.agent;

import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.events.MeshEvent;
import com.agentmesh.core.hub.ModuleBundle;
import com.agentmesh.core.hub.ModuleRegistry;
import com.agentmesh.core.metrics.MeshMetrics;
import com.agentmesh.core.model.AgentInstance;
import com.agentmesh.core.parser.ProposalParser;
import com.agentmesh.core.pool.PoolListener;
import com.agentmesh.core.pool.ResourcePool;
import com.agentmesh.core.react.LoopConfig;
import com.agentmesh.core.react.ReActLoop;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binds pooled agent instances to the hub. Every spawned instance gets its own bundle
 * {@code agent.{instanceId}} with one process endpoint whose capabilities are the lower-case role
 * name and {@code task.execute}; killing the instance unregisters the bundle.
 */
@Service
public class AgentFleet implements PoolListener {

    private static final Logger log = LoggerFactory.getLogger(AgentFleet.class);

    public static final String BUNDLE_PREFIX = "agent.";
    public static final String BUNDLE_VERSION = "1";
    public static final String TASK_CAPABILITY = "task.execute";

    private final ResourcePool pool;
    private final ModuleRegistry registry;
    private final ProposalParser parser;
    private final LoopConfig loopConfig;
    private final List<AgentProvider> providers;
    private final EventBus eventBus;
    private final MeshMetrics metrics;
    private final ExecutorService loopExecutor;
    private final Map<String, AgentEndpoint> endpoints = new ConcurrentHashMap<>();

    @Autowired
    public AgentFleet(ResourcePool pool, ModuleRegistry registry, ProposalParser parser, MeshProperties properties,
                      EventBus eventBus, @Autowired(required = false) List<AgentProvider> providers,
                      @Autowired(required = false) MeshMetrics metrics) {
        this(pool, registry, parser, LoopConfig.from(properties.getLoop()), eventBus, providers, metrics);
    }

    AgentFleet(ResourcePool pool, ModuleRegistry registry, ProposalParser parser, LoopConfig loopConfig,
               EventBus eventBus, List<AgentProvider> providers, MeshMetrics metrics) {
        this.pool = pool;
        this.registry = registry;
        this.parser = parser;
        this.loopConfig = loopConfig;
        this.eventBus = eventBus;
        this.providers = providers == null ? List.of() : List.copyOf(providers);
        this.metrics = metrics;
        var threadCount = new AtomicInteger();
        this.loopExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agentmesh-agent-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        pool.addListener(this);
        log.info("Agent fleet ready with {} provider(s): {}", this.providers.size(),
                this.providers.stream().map(AgentProvider::id).toList());
    }

    @Override
    public void instanceSpawned(AgentInstance instance) {
        Optional<AgentProvider> provider = providerFor(instance);
        if (provider.isEmpty()) {
            log.warn("No agent provider supports {} (provider {}); {} has no endpoint",
                    instance.role(), instance.providerId(), instance.id());
            return;
        }
        var loop = new ReActLoop(instance.id(), instance.role(),
                provider.get().createAgent(instance), provider.get().createActions(instance),
                loopConfig, parser, loopExecutor, metrics);
        loop.setReviewer(provider.get().createReviewer(instance));
        var endpoint = new AgentEndpoint(instance, loop, pool);
        registry.register(ModuleBundle.builder(bundleName(instance.id()), BUNDLE_VERSION)
                .process(instance.id(), List.of(instance.role().name().toLowerCase(), TASK_CAPABILITY), endpoint)
                .build());
        endpoints.put(instance.id(), endpoint);
        log.info("Agent {} [{}] bound to provider {}", instance.id(), instance.role(), provider.get().id());
        eventBus.publish(MeshEvent.of("agent.spawned", null, null,
                Map.of("agentId", instance.id(), "role", instance.role().name(), "provider", provider.get().id())));
    }

    @Override
    public void instanceKilled(AgentInstance instance) {
        var endpoint = endpoints.remove(instance.id());
        if (endpoint != null) {
            endpoint.cancel();
        }
        registry.unregister(bundleName(instance.id()));
        eventBus.publish(MeshEvent.of("agent.killed", null, null,
                Map.of("agentId", instance.id(), "role", instance.role().name())));
    }

    public Optional<AgentEndpoint> endpoint(String instanceId) {
        return Optional.ofNullable(endpoints.get(instanceId));
    }

    public List<AgentProvider> providers() {
        return providers;
    }

    public static String bundleName(String instanceId) {
        return BUNDLE_PREFIX + instanceId;
    }

    @PreDestroy
    void shutdown() {
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Optional<AgentProvider> providerFor(AgentInstance instance) {
        for (AgentProvider provider : providers) {
            if (provider.id().equals(instance.providerId()) && provider.supports(instance.role())) {
                return Optional.of(provider);
            }
        }
        return providers.stream().filter(p -> p.supports(instance.role())).findFirst();
    }
}
