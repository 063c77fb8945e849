package com.agentmesh.dispatch.cli;

import com.agentmesh.core.config.MeshProperties;
import com.agentmesh.core.persistence.Snapshot;
import com.agentmesh.core.persistence.SnapshotException;
import com.agentmesh.core.persistence.SnapshotStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentmesh inspect [--path &lt;file&gt;]
 * <p>
 * Prints the endpoints and capability routes held in the last registry snapshot.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Print the last registry snapshot")
@Component
public class InspectCommand implements Callable<Integer> {

    @Option(names = {"--path", "-p"}, description = "Snapshot file (defaults to agentmesh.snapshot.path)")
    private Path path;

    private final MeshProperties properties;
    private final ObjectMapper objectMapper;

    public InspectCommand(MeshProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path file = path != null ? path : Path.of(properties.getSnapshot().getPath());
        Snapshot snapshot;
        try {
            snapshot = new SnapshotStore(file, objectMapper).load();
        } catch (SnapshotException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (snapshot == null) {
            ConsoleOutput.info("No snapshot at " + file);
            return 0;
        }

        print(file, snapshot);
        return 0;
    }

    static void print(Path file, Snapshot snapshot) {
        ConsoleOutput.info("Snapshot " + file + " saved " + snapshot.savedAt());
        ConsoleOutput.heading("ENDPOINTS (" + snapshot.entries().size() + ")");
        snapshot.entries().forEach(ConsoleOutput::endpoint);
        ConsoleOutput.heading("ROUTES (" + snapshot.routes().size() + ")");
        snapshot.routes().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(route -> ConsoleOutput.route(route.getKey(), route.getValue()));
    }
}
