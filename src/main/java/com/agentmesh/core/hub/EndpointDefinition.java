package com.agentmesh.core.hub;

import com.agentmesh.core.model.EndpointType;

import java.util.List;
import java.util.Objects;

/**
 * One endpoint contributed by a {@link ModuleBundle}.
 *
 * @param type         input, process or output
 * @param id           id local to the type; the registry key becomes {@code {type}.{id}}
 * @param name         display name
 * @param capabilities routing tags
 * @param handler      handler invoked on delivery
 */
public record EndpointDefinition(
    EndpointType type,
    String id,
    String name,
    List<String> capabilities,
    EndpointHandler handler
) {

    public EndpointDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Endpoint id must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public String endpointId() {
        return type.endpointId(id);
    }
}
