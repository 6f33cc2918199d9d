package com.aejis.dispatch.cli;

import com.aejis.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: aejis health
 * <p>
 * Runs the docker, pool and processor checks and displays results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check engine health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
            check.metadata().forEach((k, v) -> System.out.println("    " + k + ": " + v));
        }

        System.out.println(ConsoleOutput.SEPARATOR);
        if (allUp) {
            ConsoleOutput.success("Overall: all components operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
