package com.devkit.core.model;

/**
 * One line of the run summary.
 *
 * @param attempts number of dispatches made for the task in this run
 */
public record TaskOutcome(
    String taskId,
    String title,
    TaskStatus status,
    int attempts,
    String reason
) {}
