package com.devkit.dispatch.cli;

import com.devkit.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: devkit health
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check required tools and stores")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
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
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: ready to run");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more requirements missing");
        return 1;
    }
}
