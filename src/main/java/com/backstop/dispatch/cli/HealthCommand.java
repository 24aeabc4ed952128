package com.backstop.dispatch.cli;

import com.backstop.core.health.HealthCheckService;
import com.backstop.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: backstop health
 * <p>
 * Runs every health check and exits non-zero when one is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check engine health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        boolean anyDegraded = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    anyDegraded = true;
                }
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
            }
        }

        ConsoleOutput.separator();
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more checks down");
            return 1;
        }
        if (anyDegraded) {
            ConsoleOutput.warn("Overall: running degraded");
        } else {
            ConsoleOutput.success("Overall: all checks passed");
        }
        return 0;
    }
}
