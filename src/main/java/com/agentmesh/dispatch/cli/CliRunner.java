package com.agentmesh.dispatch.cli;

import com.agentmesh.core.AgentMeshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and exposes its exit code to
 * {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final MeshCommand meshCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(MeshCommand meshCommand, IFactory factory) {
        this.meshCommand = meshCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
        log.debug("Command {} finished with exit code {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        return new CommandLine(meshCommand, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    if (e instanceof AgentMeshException) {
                        ConsoleOutput.error(e.getMessage());
                        return 1;
                    }
                    throw e;
                });
    }
}
