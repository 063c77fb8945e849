package com.agentmesh.core.react;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named action handlers available to a loop. Names are matched case-insensitively.
 */
public class ActionRegistry {

    /**
     * A registered action.
     */
    public record Action(String name, String description, ActionHandler handler) {}

    private final Map<String, Action> actions = new ConcurrentHashMap<>();

    public ActionRegistry register(String name, String description, ActionHandler handler) {
        actions.put(key(name), new Action(name, description, handler));
        return this;
    }

    public boolean contains(String name) {
        return name != null && actions.containsKey(key(name));
    }

    public Optional<Action> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(actions.get(key(name)));
    }

    public List<Action> list() {
        return actions.values().stream()
                .sorted(Comparator.comparing(Action::name))
                .toList();
    }

    /**
     * @throws ActionUnknownException when no handler is registered under {@code name}
     */
    public ActionResult execute(String name, Map<String, Object> params, ActionContext context) throws Exception {
        Action action = get(name).orElseThrow(() ->
                new ActionUnknownException(name, list().stream().map(Action::name).toList()));
        ActionResult result = action.handler().execute(params, context);
        return result != null ? result : ActionResult.success("");
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
