package com.branchwork.dispatch.cli;

import com.branchwork.core.health.HealthCheckService;
import com.branchwork.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI command: branchwork health [--verbose]
 * <p>
 * Prints the agent and coordinator checks. Exit code 0 while every component is operational
 * (UP or DEGRADED), 1 when any is DOWN or the checks are unavailable.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check agent and coordinator health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--verbose", "-v"}, description = "Also print the figures behind each check")
    private boolean verbose;

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

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            if (verbose) {
                new TreeMap<>(check.metadata()).forEach((key, value) ->
                        System.out.println("      " + key + " = " + value));
            }
        }

        HealthStatus.Status overall = HealthStatus.overall(checks);
        System.out.println("──────────────────────────────────");
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all systems operational");
            case DEGRADED -> ConsoleOutput.info("Overall: degraded, " + checks.stream()
                    .filter(c -> c.status() == HealthStatus.Status.DEGRADED).count() + " component(s) need attention");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return checks.stream().allMatch(HealthStatus::isOperational) ? 0 : 1;
    }
}
