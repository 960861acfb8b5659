package com.devkit.core.scheduler;

import com.devkit.core.model.WorkspaceHandle;

import java.time.Duration;

/**
 * Per-run settings handed to the scheduler.
 *
 * @param parentContext design or plan text of the parent ticket
 * @param maxRetries    failed attempts after which a task is skipped
 * @param taskTimeout   limit for a single execution attempt
 */
public record RunContext(
    String runId,
    WorkspaceHandle workspace,
    String parentContext,
    int maxRetries,
    Duration taskTimeout,
    RunControl control
) {
    public RunContext {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
        }
    }
}
