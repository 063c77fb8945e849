package com.agentmesh.core.agent;

import com.agentmesh.core.hub.EndpointHandler;
import com.agentmesh.core.logging.MdcContext;
import com.agentmesh.core.model.AgentInstance;
import com.agentmesh.core.model.HubMessage;
import com.agentmesh.core.model.TaskAssignment;
import com.agentmesh.core.pool.ResourcePool;
import com.agentmesh.core.react.LoopExhaustedException;
import com.agentmesh.core.react.LoopResult;
import com.agentmesh.core.react.ReActLoop;
import com.agentmesh.core.react.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Process endpoint of one agent instance: runs the instance's ReAct loop for each
 * {@link TaskAssignment} it receives and returns the final observation. Every loop state change
 * counts as a pool heartbeat, so a long multi-iteration task is not swept as stale.
 */
public class AgentEndpoint implements EndpointHandler {

    private static final Logger log = LoggerFactory.getLogger(AgentEndpoint.class);

    private final AgentInstance instance;
    private final ReActLoop loop;
    private final ResourcePool pool;

    public AgentEndpoint(AgentInstance instance, ReActLoop loop, ResourcePool pool) {
        this.instance = instance;
        this.loop = loop;
        this.pool = pool;
        loop.setProgressListener((state, iteration) -> pool.heartbeat(instance.id()));
    }

    @Override
    public Object handle(HubMessage message) {
        if (!(message.payload() instanceof TaskAssignment assignment)) {
            throw new IllegalArgumentException("Agent " + instance.id() + " expects a TaskAssignment, got "
                    + (message.payload() == null ? "null" : message.payload().getClass().getSimpleName()));
        }
        try (var mdc = MdcContext.node(assignment.orchestrationId(), assignment.nodeId(), instance.role().name())) {
            pool.heartbeat(instance.id());
            log.info("Agent {} working on node {}", instance.id(), assignment.nodeId());
            LoopResult result = loop.run(describe(assignment));
            pool.heartbeat(instance.id());
            if (result.success()) {
                return result.finalObservation();
            }
            if (result.reason() == StopReason.EXHAUSTED) {
                throw new LoopExhaustedException(result);
            }
            throw new TaskFailedException(result);
        }
    }

    public void cancel() {
        loop.cancel();
    }

    public AgentInstance instance() {
        return instance;
    }

    static String describe(TaskAssignment assignment) {
        var task = new StringBuilder(assignment.description());
        if (!assignment.inputs().isEmpty()) {
            task.append("\n\nResults of completed prerequisites:");
            for (Map.Entry<String, Object> input : assignment.inputs().entrySet()) {
                task.append("\n- ").append(input.getKey()).append(": ").append(input.getValue());
            }
        }
        return task.toString();
    }
}
