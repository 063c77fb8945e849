package com.agentmesh.core.hub;

import com.agentmesh.core.model.EndpointRef;
import com.agentmesh.core.model.EndpointType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of endpoints contributed by {@link ModuleBundle}s, indexed by endpoint id and capability.
 * <p>
 * Structural mutation (register/unregister) takes the write lock; routing lookups share the read lock,
 * so lookups run concurrently with each other but never observe a half-applied bundle.
 */
@Service
public class ModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, RegisteredEndpoint> endpoints = new LinkedHashMap<>();
    private final Map<String, Set<String>> capabilityIndex = new LinkedHashMap<>();
    private final Map<String, ActiveBundle> bundles = new LinkedHashMap<>();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * A registered endpoint with its handler.
     */
    public record RegisteredEndpoint(EndpointRef ref, EndpointHandler handler, String bundleVersion) {

        public String endpointId() {
            return ref.endpointId();
        }
    }

    private record ActiveBundle(String name, String version, List<String> endpointIds) {}

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    /**
     * Registers every endpoint of the bundle, or none.
     * <p>
     * Re-registering the same bundle name replaces its previous endpoints; with the same version this
     * is idempotent, with a different version it supersedes the old version.
     *
     * @throws DuplicateEndpointException if an endpoint id is owned by another active bundle
     *                                    or appears twice in the bundle
     */
    public void register(ModuleBundle bundle) {
        var definitions = bundle.definitions();
        var seen = new HashSet<String>();
        for (var def : definitions) {
            if (!seen.add(def.endpointId())) {
                throw new DuplicateEndpointException(def.endpointId(), bundle.name());
            }
        }

        List<String> dropped = List.of();
        lock.writeLock().lock();
        try {
            for (var def : definitions) {
                var existing = endpoints.get(def.endpointId());
                if (existing != null && !existing.ref().moduleName().equals(bundle.name())) {
                    throw new DuplicateEndpointException(def.endpointId(), existing.ref().moduleName());
                }
            }

            ActiveBundle previous = bundles.remove(bundle.name());
            if (previous != null) {
                removeEndpointsLocked(previous);
            }

            var ids = new ArrayList<String>(definitions.size());
            for (var def : definitions) {
                var ref = EndpointRef.of(def.type(), def.id(), def.name(), bundle.name(), def.capabilities());
                endpoints.put(ref.endpointId(), new RegisteredEndpoint(ref, def.handler(), bundle.version()));
                for (String capability : ref.capabilities()) {
                    capabilityIndex.computeIfAbsent(capability, k -> new LinkedHashSet<>()).add(ref.endpointId());
                }
                ids.add(ref.endpointId());
            }
            bundles.put(bundle.name(), new ActiveBundle(bundle.name(), bundle.version(), List.copyOf(ids)));
            if (previous != null) {
                dropped = previous.endpointIds().stream().filter(id -> !ids.contains(id)).toList();
            }

            if (previous == null) {
                log.info("Registered bundle {}@{} with {} endpoint(s): {}",
                        bundle.name(), bundle.version(), ids.size(), ids);
            } else if (previous.version().equals(bundle.version())) {
                log.debug("Re-registered bundle {}@{}", bundle.name(), bundle.version());
            } else {
                log.info("Bundle {} upgraded {} -> {}", bundle.name(), previous.version(), bundle.version());
            }
        } finally {
            lock.writeLock().unlock();
        }
        notifyRemoved(bundle.name(), dropped);
    }

    /**
     * Removes every endpoint of the named bundle.
     *
     * @return false if no such bundle is active
     */
    public boolean unregister(String bundleName) {
        ActiveBundle bundle;
        lock.writeLock().lock();
        try {
            bundle = bundles.remove(bundleName);
            if (bundle == null) {
                return false;
            }
            removeEndpointsLocked(bundle);
            log.info("Unregistered bundle {}@{}", bundle.name(), bundle.version());
        } finally {
            lock.writeLock().unlock();
        }
        notifyRemoved(bundleName, bundle.endpointIds());
        return true;
    }

    /**
     * Resolves a message target to exactly one process or output endpoint. The target may be a full
     * endpoint id ({@code process.exec-1}) or a bare id ({@code exec-1}).
     *
     * @throws RoutingException when nothing matches, the match is an input endpoint,
     *                          or a bare id matches more than one endpoint
     */
    public RegisteredEndpoint resolveTarget(String target) {
        lock.readLock().lock();
        try {
            var exact = endpoints.get(target);
            if (exact != null) {
                if (exact.ref().type() == EndpointType.INPUT) {
                    throw new RoutingException("Input endpoint " + target + " cannot be a message target");
                }
                return exact;
            }
            var matches = new ArrayList<RegisteredEndpoint>();
            for (var endpoint : endpoints.values()) {
                if (endpoint.ref().type() != EndpointType.INPUT && endpoint.ref().id().equals(target)) {
                    matches.add(endpoint);
                }
            }
            if (matches.isEmpty()) {
                throw new RoutingException("No endpoint registered for target " + target);
            }
            if (matches.size() > 1) {
                throw new RoutingException("Ambiguous target " + target + ": "
                        + matches.stream().map(RegisteredEndpoint::endpointId).toList());
            }
            return matches.get(0);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Process and output endpoints that declare the given capability, in registration order.
     */
    public List<RegisteredEndpoint> resolveByCapability(String capability) {
        if (capability == null) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            var ids = capabilityIndex.get(capability);
            if (ids == null) {
                return List.of();
            }
            var result = new ArrayList<RegisteredEndpoint>(ids.size());
            for (String id : ids) {
                var endpoint = endpoints.get(id);
                if (endpoint != null && endpoint.ref().type() != EndpointType.INPUT) {
                    result.add(endpoint);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RegisteredEndpoint> find(String endpointId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(endpoints.get(endpointId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<EndpointRef> endpoints() {
        lock.readLock().lock();
        try {
            return endpoints.values().stream().map(RegisteredEndpoint::ref).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<EndpointRef> endpointsByType(EndpointType type) {
        return endpoints().stream().filter(ref -> ref.type() == type).toList();
    }

    /**
     * Capability routing table: capability to endpoint ids.
     */
    public Map<String, List<String>> routes() {
        lock.readLock().lock();
        try {
            var result = new LinkedHashMap<String, List<String>>();
            capabilityIndex.forEach((capability, ids) -> result.put(capability, List.copyOf(ids)));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> bundleVersion(String bundleName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(bundles.get(bundleName)).map(ActiveBundle::version);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return endpoints.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void notifyRemoved(String bundleName, List<String> endpointIds) {
        if (endpointIds.isEmpty()) {
            return;
        }
        for (RegistryListener listener : listeners) {
            try {
                listener.endpointsRemoved(bundleName, endpointIds);
            } catch (Exception e) {
                log.warn("Registry listener failed on removal of {}: {}", endpointIds, e.getMessage(), e);
            }
        }
    }

    private void removeEndpointsLocked(ActiveBundle bundle) {
        for (String id : bundle.endpointIds()) {
            var removed = endpoints.remove(id);
            if (removed == null) continue;
            for (String capability : removed.ref().capabilities()) {
                var ids = capabilityIndex.get(capability);
                if (ids != null) {
                    ids.remove(id);
                    if (ids.isEmpty()) {
                        capabilityIndex.remove(capability);
                    }
                }
            }
        }
    }
}
