package com.devkit.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DevkitMetricsTest {

    private SimpleMeterRegistry registry;
    private DevkitMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DevkitMetrics(registry);
    }

    @Test
    @DisplayName("task outcomes are counted per label and status")
    void taskOutcome() {
        metrics.recordTaskOutcome("FEATURE", "COMPLETED");
        metrics.recordTaskOutcome("FEATURE", "COMPLETED");
        metrics.recordTaskOutcome("FEATURE", "SKIPPED");

        assertEquals(2.0, registry.get("devkit.tasks.total")
                .tag("label", "FEATURE").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.get("devkit.tasks.total").tag("status", "SKIPPED").counter().count());
    }

    @Test
    @DisplayName("gate results are tagged with gate and result")
    void gateResult() {
        metrics.recordGateResult("verification", false);
        metrics.recordGateResult("final_review", true);

        assertEquals(1.0, registry.get("devkit.gate.evaluations")
                .tag("gate", "verification").tag("result", "failed").counter().count());
        assertEquals(1.0, registry.get("devkit.gate.evaluations")
                .tag("gate", "final_review").tag("result", "passed").counter().count());
    }

    @Test
    @DisplayName("task duration, retries, attempts and run results are recorded")
    void timersAndCounters() {
        metrics.recordTaskExecution("CHORE", 1500);
        metrics.recordRetry("CHORE");
        metrics.recordAttempts(3);
        metrics.recordRunResult("incomplete");

        assertEquals(1500.0, registry.get("devkit.task.duration").timer().totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1.0, registry.get("devkit.task.retries").counter().count());
        assertEquals(3.0, registry.get("devkit.task.attempts").summary().totalAmount());
        assertEquals(1.0, registry.get("devkit.runs.total").tag("result", "incomplete").counter().count());
    }
}
