package com.agentmesh.core.persistence;

import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.hub.ModuleRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically flushes the registry snapshot to disk when its content changed, with a final flush
 * on shutdown. The snapshot found at startup is kept for recovery reporting.
 */
@Service
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    private final ModuleRegistry registry;
    private final SnapshotStore store;
    private final boolean enabled;
    private final int intervalSeconds;

    private ScheduledExecutorService flusher;
    private volatile Snapshot lastWritten;
    private volatile Snapshot recovered;

    @Autowired
    public SnapshotManager(ModuleRegistry registry, MeshProperties properties, ObjectMapper objectMapper) {
        this(registry, new SnapshotStore(Path.of(properties.getSnapshot().getPath()), objectMapper),
                properties.getSnapshot().isEnabled(), properties.getSnapshot().getIntervalSeconds());
    }

    SnapshotManager(ModuleRegistry registry, SnapshotStore store, boolean enabled, int intervalSeconds) {
        this.registry = registry;
        this.store = store;
        this.enabled = enabled;
        this.intervalSeconds = intervalSeconds;
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.debug("Registry snapshots disabled");
            return;
        }
        recovered = store.load();
        if (recovered != null) {
            log.info("Found registry snapshot from {} with {} endpoint(s) and {} route(s)",
                    recovered.savedAt(), recovered.entries().size(), recovered.routes().size());
            lastWritten = recovered;
        }
        flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentmesh-snapshot");
            t.setDaemon(true);
            return t;
        });
        flusher.scheduleAtFixedRate(this::flushSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Registry snapshots every {}s to {}", intervalSeconds, store.path());
    }

    @PreDestroy
    void stop() {
        if (flusher == null) {
            return;
        }
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(5, TimeUnit.SECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            flusher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        flushSafely();
    }

    public Snapshot capture() {
        return new Snapshot(registry.endpoints(), registry.routes(), Instant.now());
    }

    /**
     * Writes the current registry state unless it equals what was last written.
     *
     * @return true if a file was written
     */
    public synchronized boolean flushIfChanged() {
        Snapshot current = capture();
        if (current.sameContent(lastWritten)) {
            return false;
        }
        store.save(current);
        lastWritten = current;
        log.debug("Registry snapshot flushed ({} endpoints)", current.entries().size());
        return true;
    }

    /**
     * Snapshot found on disk at startup.
     */
    public Optional<Snapshot> recovered() {
        return Optional.ofNullable(recovered);
    }

    public Optional<Snapshot> load() {
        return Optional.ofNullable(store.load());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public SnapshotStore store() {
        return store;
    }

    private void flushSafely() {
        try {
            flushIfChanged();
        } catch (SnapshotException e) {
            log.warn("Registry snapshot flush failed: {}", e.getMessage(), e);
        }
    }
}
