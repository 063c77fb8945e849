package com.agentmesh.core.hub;

import com.agentmesh.core.model.EndpointType;

import java.util.ArrayList;
import java.util.List;

/**
 * A named, versioned set of endpoint definitions registered together. Registration is all-or-nothing.
 */
public record ModuleBundle(
    String name,
    String version,
    List<EndpointDefinition> inputs,
    List<EndpointDefinition> processes,
    List<EndpointDefinition> outputs
) {

    public ModuleBundle {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Bundle name must not be blank");
        }
        version = version == null || version.isBlank() ? "0" : version;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        processes = processes == null ? List.of() : List.copyOf(processes);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        requireType(inputs, EndpointType.INPUT);
        requireType(processes, EndpointType.PROCESS);
        requireType(outputs, EndpointType.OUTPUT);
    }

    public List<EndpointDefinition> definitions() {
        var all = new ArrayList<EndpointDefinition>(inputs.size() + processes.size() + outputs.size());
        all.addAll(inputs);
        all.addAll(processes);
        all.addAll(outputs);
        return all;
    }

    public static Builder builder(String name, String version) {
        return new Builder(name, version);
    }

    private static void requireType(List<EndpointDefinition> defs, EndpointType expected) {
        for (var def : defs) {
            if (def.type() != expected) {
                throw new IllegalArgumentException("Endpoint " + def.endpointId() + " listed as " + expected.prefix());
            }
        }
    }

    public static final class Builder {
        private final String name;
        private final String version;
        private final List<EndpointDefinition> inputs = new ArrayList<>();
        private final List<EndpointDefinition> processes = new ArrayList<>();
        private final List<EndpointDefinition> outputs = new ArrayList<>();

        private Builder(String name, String version) {
            this.name = name;
            this.version = version;
        }

        public Builder input(String id, List<String> capabilities, EndpointHandler handler) {
            inputs.add(new EndpointDefinition(EndpointType.INPUT, id, id, capabilities, handler));
            return this;
        }

        public Builder process(String id, List<String> capabilities, EndpointHandler handler) {
            processes.add(new EndpointDefinition(EndpointType.PROCESS, id, id, capabilities, handler));
            return this;
        }

        public Builder output(String id, List<String> capabilities, EndpointHandler handler) {
            outputs.add(new EndpointDefinition(EndpointType.OUTPUT, id, id, capabilities, handler));
            return this;
        }

        public ModuleBundle build() {
            return new ModuleBundle(name, version, inputs, processes, outputs);
        }
    }
}
