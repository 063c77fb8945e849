package com.agentmesh.dispatch.cli;

import com.agentmesh.core.health.HealthCheckService;
import com.agentmesh.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: agentmesh health
 * <p>
 * Prints one line per component. Exits with 1 unless every component is UP.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check engine health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }
        return report(healthCheckService.checkAll());
    }

    static int report(List<HealthStatus> checks) {
        checks.forEach(ConsoleOutput::status);
        ConsoleOutput.rule();

        long notUp = checks.stream().filter(check -> !check.isUp()).count();
        if (notUp == 0) {
            ConsoleOutput.success("All " + checks.size() + " components operational");
            return 0;
        }
        ConsoleOutput.error(notUp + " of " + checks.size() + " components degraded or down");
        return 1;
    }
}
