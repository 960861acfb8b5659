package com.devkit.executor;

import com.devkit.core.model.Task;
import com.devkit.core.model.WorkspaceHandle;

/**
 * Everything an execution strategy gets to work on one task attempt.
 *
 * @param task          the task being attempted
 * @param parentContext design or plan text of the parent ticket (may be empty)
 * @param workspace     the run's checkout; strategies make their changes here
 * @param attempt       1-based attempt number
 * @param maxAttempts   attempts allowed before the task is skipped
 */
public record TaskContext(
    Task task,
    String parentContext,
    WorkspaceHandle workspace,
    int attempt,
    int maxAttempts
) {}
