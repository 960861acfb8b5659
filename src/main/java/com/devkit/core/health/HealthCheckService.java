package com.devkit.core.health;

import com.devkit.config.DevkitProperties;
import com.devkit.core.persistence.TicketStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Checks that the tools and stores a run depends on are available.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DevkitProperties properties;
    private final TicketStore ticketStore;

    public HealthCheckService(DevkitProperties properties, TicketStore ticketStore) {
        this.properties = properties;
        this.ticketStore = ticketStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTool("git", "git", "--version"));
        results.add(checkTool("check runner", properties.getVerification().getCommand(), "--version"));
        results.add(checkRepository());
        results.add(checkTicketStore());
        return results;
    }

    HealthStatus checkTool(String component, String... command) {
        try {
            var process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new HealthStatus(component, HealthStatus.Status.DOWN, command[0] + " did not respond");
            }
            if (process.exitValue() == 0) {
                return new HealthStatus(component, HealthStatus.Status.UP, command[0] + " available");
            }
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    command[0] + " exited with code " + process.exitValue());
        } catch (IOException e) {
            log.debug("{} not runnable: {}", command[0], e.getMessage());
            return new HealthStatus(component, HealthStatus.Status.DOWN, command[0] + " not found on PATH");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthStatus(component, HealthStatus.Status.DOWN, "interrupted");
        }
    }

    private HealthStatus checkRepository() {
        Path repository = Path.of(properties.getWorkspace().getRepository());
        if (Files.isDirectory(repository.resolve(".git")) || Files.isRegularFile(repository.resolve(".git"))) {
            return new HealthStatus("repository", HealthStatus.Status.UP, repository.toAbsolutePath().normalize().toString());
        }
        return new HealthStatus("repository", HealthStatus.Status.DOWN,
                repository.toAbsolutePath().normalize() + " is not a git repository");
    }

    private HealthStatus checkTicketStore() {
        try {
            ticketStore.getParentContext("__health__");
            return new HealthStatus("ticket store", HealthStatus.Status.UP,
                    properties.getTicketStore().getType() + " store reachable");
        } catch (RuntimeException e) {
            log.warn("Ticket store health check failed: {}", e.getMessage());
            return new HealthStatus("ticket store", HealthStatus.Status.DOWN, "error: " + e.getMessage());
        }
    }
}
