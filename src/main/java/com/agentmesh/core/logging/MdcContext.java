package com.agentmesh.core.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MDC keys used by AgentMesh log patterns, opened as scopes that put back whatever the thread had
 * before. Nested scopes (orchestration, then node inside an agent) therefore unwind cleanly.
 */
public final class MdcContext {

    public static final String ORCHESTRATION = "orchestrationId";
    public static final String NODE = "nodeId";
    public static final String ROLE = "agentRole";
    public static final String ROUND = "round";

    public static final List<String> KEYS = List.of(ORCHESTRATION, NODE, ROLE, ROUND);

    private MdcContext() {}

    public static Scope orchestration(String orchestrationId) {
        return new Scope().put(ORCHESTRATION, orchestrationId);
    }

    public static Scope node(String orchestrationId, String nodeId, String agentRole) {
        return orchestration(orchestrationId).put(NODE, nodeId).put(ROLE, agentRole);
    }

    /** Drops every AgentMesh key, leaving foreign MDC entries alone. */
    public static void clear() {
        KEYS.forEach(MDC::remove);
    }

    /**
     * Keys set through one scope. {@link #close()} restores the values seen when each key was first
     * touched.
     */
    public static final class Scope implements AutoCloseable {

        private final Map<String, String> previous = new LinkedHashMap<>();

        private Scope() {}

        public Scope put(String key, Object value) {
            if (!previous.containsKey(key)) {
                previous.put(key, MDC.get(key));
            }
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, String.valueOf(value));
            }
            return this;
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
            previous.clear();
        }
    }
}
