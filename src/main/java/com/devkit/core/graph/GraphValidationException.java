package com.devkit.core.graph;

import java.util.List;

/**
 * Thrown when a set of task records cannot form a valid task graph.
 * Always fatal: no task runs once this has been raised.
 */
public class GraphValidationException extends RuntimeException {

    private final List<String> taskIds;

    public GraphValidationException(String message, List<String> taskIds) {
        super(message);
        this.taskIds = List.copyOf(taskIds);
    }

    /** Ids of the tasks at fault. */
    public List<String> getTaskIds() {
        return taskIds;
    }
}
