package com.agentmesh.core.health;

import com.agentmesh.core.hub.MessageHub;
import com.agentmesh.core.model.AgentStatus;
import com.agentmesh.core.persistence.SnapshotException;
import com.agentmesh.core.persistence.SnapshotManager;
import com.agentmesh.core.pool.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String HUB = "hub";
    static final String POOL = "pool";
    static final String SNAPSHOT = "snapshot";

    private final MessageHub hub;
    private final ResourcePool pool;
    private final SnapshotManager snapshotManager;

    public HealthCheckService(
            @Autowired(required = false) MessageHub hub,
            @Autowired(required = false) ResourcePool pool,
            @Autowired(required = false) SnapshotManager snapshotManager) {
        this.hub = hub;
        this.pool = pool;
        this.snapshotManager = snapshotManager;
    }

    /**
     * Checks the hub, the pool and the snapshot store, in that order.
     */
    public List<HealthStatus> checkAll() {
        return List.of(checkHub(), checkPool(), checkSnapshots());
    }

    private HealthStatus checkHub() {
        if (hub == null) {
            return HealthStatus.down(HUB, "Message hub not available");
        }
        if (!hub.isRunning()) {
            return HealthStatus.down(HUB, "Message hub stopped");
        }
        int endpoints = hub.registry().size();
        return HealthStatus.up(HUB, "Routing " + endpoints + " endpoint(s)",
                Map.of("endpoints", String.valueOf(endpoints)));
    }

    private HealthStatus checkPool() {
        if (pool == null) {
            return HealthStatus.down(POOL, "Resource pool not available");
        }
        var report = pool.statusReport();
        int errors = report.count(AgentStatus.ERROR);
        var metadata = Map.of(
                "total", String.valueOf(report.total()),
                "idle", String.valueOf(report.count(AgentStatus.IDLE)),
                "running", String.valueOf(report.count(AgentStatus.RUNNING)),
                "error", String.valueOf(errors));
        return errors > 0
                ? HealthStatus.degraded(POOL, errors + " instance(s) in ERROR", metadata)
                : HealthStatus.up(POOL, report.total() + " instance(s)", metadata);
    }

    private HealthStatus checkSnapshots() {
        if (snapshotManager == null || !snapshotManager.isEnabled()) {
            return HealthStatus.degraded(SNAPSHOT, "Registry snapshots disabled", Map.of());
        }
        var path = Map.of("path", snapshotManager.store().path().toString());
        try {
            var stored = snapshotManager.load();
            return HealthStatus.up(SNAPSHOT,
                    stored.map(s -> "Last snapshot " + s.savedAt()).orElse("No snapshot written yet"), path);
        } catch (SnapshotException e) {
            log.warn("Snapshot health check failed: {}", e.getMessage());
            return new HealthStatus(SNAPSHOT, HealthStatus.Status.DOWN, e.getMessage(), path);
        }
    }
}
