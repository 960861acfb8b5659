package com.devkit.core.health;

import com.devkit.config.DevkitProperties;
import com.devkit.core.persistence.InMemoryTicketStore;
import com.devkit.core.persistence.TicketStore;
import com.devkit.core.persistence.TicketStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path repo;

    private DevkitProperties properties() {
        var properties = new DevkitProperties();
        properties.getWorkspace().setRepository(repo.toString());
        properties.getVerification().setCommand("devkit-no-such-runner");
        return properties;
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream().filter(h -> h.component().equals(component)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("reports every component")
    void checksAllComponents() throws Exception {
        Files.createDirectories(repo.resolve(".git"));
        var results = new HealthCheckService(properties(), new InMemoryTicketStore()).checkAll();

        assertEquals(4, results.size());
        assertEquals(HealthStatus.Status.UP, find(results, "repository").status());
        assertEquals(HealthStatus.Status.UP, find(results, "ticket store").status());
        assertEquals(HealthStatus.Status.DOWN, find(results, "check runner").status());
    }

    @Test
    @DisplayName("directory without .git is not a repository")
    void notARepository() {
        var results = new HealthCheckService(properties(), new InMemoryTicketStore()).checkAll();

        assertEquals(HealthStatus.Status.DOWN, find(results, "repository").status());
    }

    @Test
    @DisplayName("failing ticket store is reported down")
    void ticketStoreDown() {
        TicketStore store = mock(TicketStore.class);
        when(store.getParentContext(anyString())).thenThrow(new TicketStoreException("connection refused"));

        var results = new HealthCheckService(properties(), store).checkAll();

        var status = find(results, "ticket store");
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("missing executable is reported as not found")
    void missingTool() {
        var status = new HealthCheckService(properties(), new InMemoryTicketStore())
                .checkTool("runner", "devkit-no-such-runner", "--version");

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("not found"));
    }
}
