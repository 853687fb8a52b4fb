package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.health.HealthCheckService;
import com.vulnconsole.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: vulnconsole health
 * <p>
 * Checks the catalog root, the cache file and the container runtime.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            String path = check.metadata().get("path");
            if (path != null) {
                label += " (" + path + ")";
            }
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
        } else {
            ConsoleOutput.success("Overall: ready");
        }
    }
}
