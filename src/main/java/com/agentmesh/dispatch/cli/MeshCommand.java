package com.agentmesh.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * {@code agentmesh} root command. Run bare, it prints the banner and the subcommand list.
 */
@Command(name = "agentmesh",
        mixinStandardHelpOptions = true,
        version = "AgentMesh 0.1.0",
        description = "Multi-agent task orchestration engine",
        subcommands = {HealthCommand.class, InspectCommand.class, HelpCommand.class})
@Component
public class MeshCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
