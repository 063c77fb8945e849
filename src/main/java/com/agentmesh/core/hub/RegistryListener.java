package com.agentmesh.core.hub;

import java.util.List;

/**
 * Structural callbacks from the {@link ModuleRegistry}, invoked after the write lock is released.
 */
@FunctionalInterface
public interface RegistryListener {

    /**
     * Endpoints that left the registry through {@code unregister} or through a re-registration that
     * no longer declares them.
     */
    void endpointsRemoved(String bundleName, List<String> endpointIds);
}
