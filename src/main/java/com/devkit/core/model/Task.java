package com.devkit.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A single unit of work within a run. Instances are immutable; the scheduler
 * replaces a task in its graph with the copy returned by one of the {@code with*} methods.
 *
 * @param id           stable external identifier (the ticket id)
 * @param title        short human-readable title
 * @param description  full task description handed to the execution strategy
 * @param label        category that selects the execution strategy
 * @param dependencies ids of tasks that must be {@link TaskStatus#COMPLETED} first, in declared order
 * @param status       current status
 * @param retryCount   failed attempts so far
 * @param reason       why the task last failed, was skipped or blocked (nullable)
 */
public record Task(
    String id,
    String title,
    String description,
    TaskLabel label,
    List<String> dependencies,
    TaskStatus status,
    int retryCount,
    String reason
) implements Serializable {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative: " + retryCount);
        }
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, title, description, label, dependencies, newStatus, retryCount, reason);
    }

    public Task withStatus(TaskStatus newStatus, String newReason) {
        return new Task(id, title, description, label, dependencies, newStatus, retryCount, newReason);
    }

    /** Records a failed attempt: bumps the retry count and stores the failure reason. */
    public Task withFailure(String failureReason) {
        return new Task(id, title, description, label, dependencies, status, retryCount + 1, failureReason);
    }

    /** Fresh attempt budget, used when a run is resumed. */
    public Task reset() {
        return new Task(id, title, description, label, dependencies, TaskStatus.PENDING, 0, null);
    }
}
