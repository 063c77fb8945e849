package com.agentmesh.core.pool;

import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.metrics.MeshMetrics;
import com.agentmesh.core.model.AgentInstance;
import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.model.AgentStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owns the lifecycle and per-role capacity of agent instances.
 * <p>
 * Every structural mutation runs under one lock and status changes are compare-and-set against the
 * expected current status, so two concurrent allocations never receive the same instance.
 * Instances are only ever removed by {@link #kill(String)}; a missed heartbeat marks an instance
 * {@link AgentStatus#ERROR} but keeps it in the pool.
 */
@Service
public class ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    public static final String DEFAULT_PROVIDER = "default";

    private static final Comparator<AgentInstance> OLDEST_IDLE_FIRST =
            Comparator.comparing(AgentInstance::idleSince).thenComparing(AgentInstance::id);

    private final MeshProperties.Pool config;
    private final MeshMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition instanceReleased = lock.newCondition();
    private final Map<String, AgentInstance> instances = new LinkedHashMap<>();
    private final List<PoolListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService sweeper;

    @Autowired
    public ResourcePool(MeshProperties properties, @Autowired(required = false) MeshMetrics metrics) {
        this(properties.getPool(), metrics, Clock.systemUTC());
    }

    public ResourcePool(MeshProperties.Pool config, MeshMetrics metrics, Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void startSweeper() {
        int interval = config.getSweepIntervalSeconds();
        if (interval <= 0) {
            log.info("Heartbeat sweep disabled");
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentmesh-pool-sweep");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(this::sweepSafely, interval, interval, TimeUnit.SECONDS);
        log.info("Heartbeat sweep started (interval={}s, timeout={}s)",
                interval, config.getHeartbeatTimeoutSeconds());
    }

    @PreDestroy
    void stopSweeper() {
        if (sweeper == null) {
            return;
        }
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public void addListener(PoolListener listener) {
        listeners.add(listener);
    }

    /**
     * Creates a new IDLE instance.
     *
     * @throws CapacityExceededException if the role is at its configured maximum
     */
    public AgentInstance spawn(AgentRole role, String providerId) {
        AgentInstance spawned;
        lock.lock();
        try {
            spawned = spawnLocked(role, providerId);
        } finally {
            lock.unlock();
        }
        notifySpawned(spawned);
        return spawned;
    }

    public AgentInstance allocate(AgentRole role) {
        return allocate(role, null);
    }

    /**
     * Hands out the oldest idle instance of the role, spawning one while under capacity.
     * The returned instance is RUNNING and bound to {@code taskId}. At capacity this waits up to the
     * configured allocation wait for a release.
     *
     * @throws NoAvailableAgentException when the role is at capacity with no idle instance and the
     *                                   configured allocation wait elapsed
     */
    public AgentInstance allocate(AgentRole role, String taskId) {
        AgentInstance allocated = allocate(role, taskId, TimeUnit.MILLISECONDS.toNanos(config.getAllocationWaitMillis()));
        if (allocated == null) {
            throw new NoAvailableAgentException(role, busyDetail(role));
        }
        return allocated;
    }

    /**
     * Like {@link #allocate(AgentRole, String)} but never waits: empty when the role is at capacity
     * with no idle instance.
     */
    public Optional<AgentInstance> tryAllocate(AgentRole role, String taskId) {
        return Optional.ofNullable(allocate(role, taskId, 0L));
    }

    private AgentInstance allocate(AgentRole role, String taskId, long waitNanos) {
        AgentInstance spawned = null;
        AgentInstance allocated;
        long remainingNanos = waitNanos;
        lock.lock();
        try {
            while (true) {
                Optional<AgentInstance> idle = instances.values().stream()
                        .filter(i -> i.role() == role && i.status() == AgentStatus.IDLE)
                        .min(OLDEST_IDLE_FIRST);
                if (idle.isPresent()) {
                    allocated = transitionLocked(idle.get().id(), AgentStatus.IDLE, i -> i.running(taskId));
                    break;
                }
                if (countLocked(role) < capacity(role)) {
                    spawned = spawnLocked(role, DEFAULT_PROVIDER);
                    allocated = transitionLocked(spawned.id(), AgentStatus.IDLE, i -> i.running(taskId));
                    break;
                }
                if (remainingNanos <= 0) {
                    recordAllocation(role, "exhausted");
                    return null;
                }
                try {
                    remainingNanos = instanceReleased.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new NoAvailableAgentException(role, "interrupted while waiting");
                }
            }
        } finally {
            lock.unlock();
        }
        if (spawned != null) {
            notifySpawned(spawned);
        }
        recordAllocation(role, spawned != null ? "spawned" : "reused");
        log.debug("Allocated {} [{}] for task {}", allocated.id(), role, taskId);
        return allocated;
    }

    /**
     * Records the outcome of the instance's current task: RUNNING to SUCCESS or ERROR.
     *
     * @return false if the instance is unknown or not RUNNING
     */
    public boolean complete(String instanceId, boolean success) {
        lock.lock();
        try {
            return transitionLocked(instanceId, AgentStatus.RUNNING,
                    i -> i.withStatus(success ? AgentStatus.SUCCESS : AgentStatus.ERROR)) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the instance to IDLE from any status, keeping its identity and role.
     *
     * @return false if the instance is unknown
     */
    public boolean release(String instanceId) {
        lock.lock();
        try {
            AgentInstance current = instances.get(instanceId);
            if (current == null) {
                return false;
            }
            instances.put(instanceId, current.idle(clock.instant()));
            instanceReleased.signalAll();
            log.debug("Released {} (was {})", instanceId, current.status());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean heartbeat(String instanceId) {
        lock.lock();
        try {
            AgentInstance current = instances.get(instanceId);
            if (current == null) {
                return false;
            }
            instances.put(instanceId, current.heartbeat(clock.instant()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Permanently removes the instance. Work in flight is not re-routed.
     *
     * @return false if the instance is unknown
     */
    public boolean kill(String instanceId) {
        AgentInstance removed;
        lock.lock();
        try {
            removed = instances.remove(instanceId);
            if (removed != null) {
                instanceReleased.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        log.info("Killed {} [{}] (status {})", removed.id(), removed.role(), removed.status());
        for (PoolListener listener : listeners) {
            try {
                listener.instanceKilled(removed);
            } catch (Exception e) {
                log.warn("Pool listener failed on kill of {}: {}", removed.id(), e.getMessage(), e);
            }
        }
        return true;
    }

    /**
     * Marks RUNNING instances whose last heartbeat is older than the configured timeout as ERROR.
     *
     * @return ids of the instances marked in this pass
     */
    public List<String> sweepNow() {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(config.getHeartbeatTimeoutSeconds()));
        var stale = new ArrayList<AgentInstance>();
        lock.lock();
        try {
            for (AgentInstance instance : List.copyOf(instances.values())) {
                if (instance.status() == AgentStatus.RUNNING && instance.lastHeartbeat().isBefore(cutoff)) {
                    AgentInstance marked = transitionLocked(instance.id(), AgentStatus.RUNNING,
                            i -> i.withStatus(AgentStatus.ERROR));
                    if (marked != null) {
                        stale.add(marked);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        for (AgentInstance instance : stale) {
            log.warn("Instance {} [{}] missed heartbeat (last {}), marked ERROR",
                    instance.id(), instance.role(), instance.lastHeartbeat());
            if (metrics != null) {
                metrics.recordStaleInstance(instance.role().name());
            }
        }
        return stale.stream().map(AgentInstance::id).toList();
    }

    public Optional<AgentInstance> get(String instanceId) {
        lock.lock();
        try {
            return Optional.ofNullable(instances.get(instanceId));
        } finally {
            lock.unlock();
        }
    }

    public List<AgentInstance> instances() {
        lock.lock();
        try {
            return List.copyOf(instances.values());
        } finally {
            lock.unlock();
        }
    }

    public List<AgentInstance> instances(AgentRole role) {
        return instances().stream().filter(i -> i.role() == role).toList();
    }

    public int capacity(AgentRole role) {
        return config.maxInstancesFor(role);
    }

    public PoolStatusReport statusReport() {
        var byStatus = new EnumMap<AgentStatus, Integer>(AgentStatus.class);
        var byRole = new EnumMap<AgentRole, Integer>(AgentRole.class);
        var capacity = new EnumMap<AgentRole, Integer>(AgentRole.class);
        List<AgentInstance> snapshot = instances();
        for (AgentInstance instance : snapshot) {
            byStatus.merge(instance.status(), 1, Integer::sum);
            byRole.merge(instance.role(), 1, Integer::sum);
        }
        for (AgentRole role : AgentRole.values()) {
            capacity.put(role, capacity(role));
        }
        return new PoolStatusReport(snapshot.size(), byStatus, byRole, capacity);
    }

    private void sweepSafely() {
        try {
            sweepNow();
        } catch (Exception e) {
            log.warn("Heartbeat sweep failed: {}", e.getMessage(), e);
        }
    }

    private AgentInstance spawnLocked(AgentRole role, String providerId) {
        int max = capacity(role);
        if (countLocked(role) >= max) {
            throw new CapacityExceededException(role, max);
        }
        Instant now = clock.instant();
        String id = role.name().toLowerCase() + "-" + UUID.randomUUID().toString().substring(0, 8);
        var instance = new AgentInstance(id, role, providerId == null ? DEFAULT_PROVIDER : providerId,
                AgentStatus.IDLE, now, now, now, null, 0);
        instances.put(id, instance);
        log.info("Spawned {} [{}] via provider {}", id, role, instance.providerId());
        return instance;
    }

    /**
     * Compare-and-set on status: applies {@code change} only when the instance is currently {@code expected}.
     */
    private AgentInstance transitionLocked(String instanceId, AgentStatus expected,
                                           UnaryOperator<AgentInstance> change) {
        AgentInstance current = instances.get(instanceId);
        if (current == null || current.status() != expected) {
            return null;
        }
        AgentInstance next = change.apply(current);
        instances.put(instanceId, next);
        return next;
    }

    private String busyDetail(AgentRole role) {
        lock.lock();
        try {
            return countLocked(role) + "/" + capacity(role) + " instances busy";
        } finally {
            lock.unlock();
        }
    }

    private int countLocked(AgentRole role) {
        int count = 0;
        for (AgentInstance instance : instances.values()) {
            if (instance.role() == role) count++;
        }
        return count;
    }

    private void notifySpawned(AgentInstance instance) {
        for (PoolListener listener : listeners) {
            try {
                listener.instanceSpawned(instance);
            } catch (Exception e) {
                log.warn("Pool listener failed on spawn of {}: {}", instance.id(), e.getMessage(), e);
            }
        }
    }

    private void recordAllocation(AgentRole role, String outcome) {
        if (metrics != null) {
            metrics.recordAllocation(role.name(), outcome);
        }
    }
}
