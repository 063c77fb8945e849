package com.agentmesh.core.pool;

import com.agentmesh.core.model.AgentInstance;

/**
 * Lifecycle callbacks from the {@link ResourcePool}, invoked outside the pool lock.
 */
public interface PoolListener {

    void instanceSpawned(AgentInstance instance);

    void instanceKilled(AgentInstance instance);
}
