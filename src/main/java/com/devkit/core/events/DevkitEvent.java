package com.devkit.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, consumed by the CLI progress output.
 *
 * @param eventType e.g. "run.started", "task.started", "task.completed", "task.skipped"
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record DevkitEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static DevkitEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new DevkitEvent(eventType, runId, taskId, payload, Instant.now());
    }
}
