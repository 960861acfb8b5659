package com.devkit.core.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessTreeTest {

    private static List<ProcessHandle> awaitDescendants(Process process) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            var descendants = process.descendants().toList();
            if (!descendants.isEmpty()) {
                return descendants;
            }
            Thread.sleep(20);
        }
        fail("shell did not start its background job");
        return List.of();
    }

    @Test
    @DisplayName("destroys the process and everything it started")
    void destroysDescendants() throws Exception {
        var process = new ProcessBuilder("sh", "-c", "sleep 30 & wait").start();
        var descendants = awaitDescendants(process);

        assertTrue(ProcessTree.destroy(process, Duration.ofSeconds(5)));

        assertFalse(process.isAlive());
        for (ProcessHandle child : descendants) {
            assertFalse(child.isAlive(), "child " + child.pid() + " still alive");
        }
    }

    @Test
    @DisplayName("keeps the caller's interrupt flag without cutting the wait short")
    void preservesInterrupt() throws Exception {
        var process = new ProcessBuilder("sh", "-c", "sleep 30 & wait").start();
        awaitDescendants(process);

        Thread.currentThread().interrupt();
        try {
            assertTrue(ProcessTree.destroy(process, Duration.ofSeconds(5)));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertFalse(process.isAlive());
    }
}
