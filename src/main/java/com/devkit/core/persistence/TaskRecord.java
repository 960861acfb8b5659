package com.devkit.core.persistence;

import com.devkit.core.model.TaskStatus;

import java.io.Serializable;
import java.util.List;

/**
 * A child ticket as read from the ticket store, before validation.
 *
 * @param label  raw label text; validated when the task graph is loaded
 * @param status last persisted status, null when the ticket was never touched by a run
 */
public record TaskRecord(
    String id,
    String title,
    String description,
    String label,
    List<String> dependencies,
    TaskStatus status
) implements Serializable {

    public TaskRecord {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public TaskRecord withStatus(TaskStatus newStatus) {
        return new TaskRecord(id, title, description, label, dependencies, newStatus);
    }
}
