package com.agentmesh.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Registry view of an endpoint.
 *
 * @param endpointId   unique registry key in the form {@code {type}.{id}}
 * @param type         input, process or output
 * @param id           id local to the endpoint type
 * @param name         human-readable name
 * @param moduleName   name of the bundle that contributed the endpoint
 * @param capabilities routing tags matched against {@link HubMessage#type()} for untargeted messages
 */
public record EndpointRef(
    String endpointId,
    EndpointType type,
    String id,
    String name,
    String moduleName,
    List<String> capabilities
) implements Serializable {

    public EndpointRef {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public static EndpointRef of(EndpointType type, String id, String name, String moduleName,
                                 List<String> capabilities) {
        return new EndpointRef(type.endpointId(id), type, id, name, moduleName, capabilities);
    }

    public boolean hasCapability(String capability) {
        return capability != null && capabilities.contains(capability);
    }
}
