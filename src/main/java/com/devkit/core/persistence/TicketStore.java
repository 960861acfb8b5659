package com.devkit.core.persistence;

import com.devkit.core.model.TaskStatus;

import java.util.List;

/**
 * System of record for the child tickets a run executes.
 * <p>
 * Implementations may be slow or fail; failures surface as {@link TicketStoreException}.
 */
public interface TicketStore {

    /** Child tickets of {@code parentId}, in creation order. */
    List<TaskRecord> getChildTasks(String parentId);

    void updateStatus(String taskId, TaskStatus status);

    void appendNote(String taskId, String text);

    /** Design or plan text attached to the parent ticket; empty when there is none. */
    default String getParentContext(String parentId) {
        return "";
    }
}
