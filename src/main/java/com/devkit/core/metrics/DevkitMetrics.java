package com.devkit.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for run execution.
 */
@Service
public class DevkitMetrics {

    private final MeterRegistry registry;

    public DevkitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String label, long ms) {
        Timer.builder("devkit.task.duration")
                .tag("label", label)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String label, String status) {
        Counter.builder("devkit.tasks.total")
                .tag("label", label)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRetry(String label) {
        Counter.builder("devkit.task.retries")
                .tag("label", label)
                .register(registry)
                .increment();
    }

    /**
     * @param gate "verification", "review" or "final_review"
     */
    public void recordGateResult(String gate, boolean passed) {
        Counter.builder("devkit.gate.evaluations")
                .tag("gate", gate)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordAttempts(int attempts) {
        DistributionSummary.builder("devkit.task.attempts")
                .register(registry)
                .record(attempts);
    }

    public void recordPersistFailure() {
        Counter.builder("devkit.persist.failures")
                .description("Status writes to the ticket store that failed")
                .register(registry)
                .increment();
    }

    public void recordRunResult(String result) {
        Counter.builder("devkit.runs.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
