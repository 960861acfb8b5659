package com.devkit.core.model;

/**
 * Lifecycle of a single task within a run.
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED,
    BLOCKED;

    /** Terminal for the current run: the scheduler never dispatches the task again. */
    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == BLOCKED;
    }
}
