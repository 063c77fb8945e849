package com.agentmesh.core.health;

import java.util.Map;

/**
 * Result of one component health check.
 *
 * @param component short component name, e.g. "hub"
 * @param status    overall state of the component
 * @param detail    one-line human-readable explanation
 * @param metadata  extra facts such as counts or paths
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
