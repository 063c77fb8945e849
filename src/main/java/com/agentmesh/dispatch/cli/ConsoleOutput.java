package com.agentmesh.dispatch.cli;

import com.agentmesh.core.health.HealthStatus;
import com.agentmesh.core.model.EndpointRef;
import picocli.CommandLine.Help.Ansi;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Terminal output for the AgentMesh CLI. Markup is rendered through picocli's {@link Ansi#AUTO},
 * so colors disappear when stdout is not a terminal.
 */
public final class ConsoleOutput {

    private static final String RULE = "-".repeat(48);

    private ConsoleOutput() {}

    public static void printBanner() {
        print("@|bold,fg(cyan) agentmesh|@ @|faint 0.1.0|@");
        rule();
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void heading(String title) {
        System.out.println();
        print("@|bold " + escape(title) + "|@");
    }

    public static void info(String message) {
        print("@|fg(cyan) *|@ " + escape(message));
    }

    public static void success(String message) {
        print("@|fg(green) ok|@ " + escape(message));
    }

    public static void warn(String message) {
        print("@|fg(yellow) !!|@ " + escape(message));
    }

    public static void error(String message) {
        print("@|fg(red) xx|@ " + escape(message));
    }

    /**
     * One health line, colored by status, followed by the component's metadata.
     */
    public static void status(HealthStatus check) {
        String line = String.format("%-9s %s", check.component(), check.detail());
        switch (check.status()) {
            case UP -> success(line);
            case DEGRADED -> warn(line);
            case DOWN -> error(line);
        }
        if (!check.metadata().isEmpty()) {
            System.out.println("          " + formatMetadata(check.metadata()));
        }
    }

    public static void endpoint(EndpointRef ref) {
        System.out.printf("  %-32s %-8s %-20s %s%n",
                ref.endpointId(), ref.type(), ref.moduleName(), String.join(", ", ref.capabilities()));
    }

    public static void route(String capability, List<String> endpointIds) {
        print("  @|fg(blue) " + escape(capability) + "|@ -> " + escape(String.join(", ", endpointIds)));
    }

    static String formatMetadata(Map<String, String> metadata) {
        return metadata.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }

    private static void print(String markup) {
        System.out.println(Ansi.AUTO.string(markup));
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("@|", "@ |").replace("|@", "| @");
    }
}
