package com.agentmesh.core.engine;

import com.agentmesh.core.agent.AgentProvider;
import com.agentmesh.core.model.AgentInstance;
import com.agentmesh.core.model.AgentRole;
import com.agentmesh.core.react.ActionRegistry;
import com.agentmesh.core.react.ActionResult;
import com.agentmesh.core.react.AgentCapability;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test provider whose agents react to keywords in the task description:
 * "broken" always gives up, "flaky" gives up on its first attempt only,
 * "endless" keeps reading forever, anything else completes at once.
 */
class ScriptedAgentProvider implements AgentProvider {

    final List<String> tasks = new CopyOnWriteArrayList<>();
    final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    @Override
    public String id() {
        return "scripted";
    }

    @Override
    public boolean supports(AgentRole role) {
        return true;
    }

    @Override
    public AgentCapability createAgent(AgentInstance instance) {
        return (task, trace) -> {
            String headline = task.lines().findFirst().orElse("");
            if (trace.isEmpty()) {
                tasks.add(task);
                attempts.computeIfAbsent(headline, k -> new AtomicInteger()).incrementAndGet();
            }
            if (headline.contains("broken")
                    || (headline.contains("flaky") && attempts.get(headline).get() == 1)) {
                return "{\"action\": \"FAIL\", \"params\": {\"reason\": \"cannot do " + headline + "\"}}";
            }
            if (headline.contains("endless")) {
                return "{\"thought\": \"keep looking\", \"action\": \"READ\", \"params\": {}}";
            }
            return "{\"thought\": \"easy\", \"action\": \"COMPLETE\", \"params\": {\"result\": \"done " + headline + "\"}}";
        };
    }

    @Override
    public ActionRegistry createActions(AgentInstance instance) {
        var counter = new AtomicInteger();
        return new ActionRegistry()
                .register("READ", "read something", (params, ctx) -> ActionResult.success("page " + counter.incrementAndGet()));
    }

    int attemptsFor(String headline) {
        var count = attempts.get(headline);
        return count == null ? 0 : count.get();
    }
}
