package com.devkit.core.persistence;

import com.devkit.core.metrics.DevkitMetrics;
import com.devkit.core.model.Task;
import com.devkit.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes task status through to the {@link TicketStore} so an interrupted run can be resumed.
 * <p>
 * A failed write never rolls back the in-memory transition. The task is remembered and its
 * latest status is written again on the next transition of the same task or by
 * {@link #retryPending()}; whatever still fails is reported by {@link #unsyncedTaskIds()}.
 */
@Service
public class StateSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(StateSynchronizer.class);

    private final TicketStore ticketStore;
    private final DevkitMetrics metrics;

    /** Latest status per task whose write has not yet succeeded, insertion ordered. */
    private final Map<String, TaskStatus> pending = new LinkedHashMap<>();

    public StateSynchronizer(TicketStore ticketStore, DevkitMetrics metrics) {
        this.ticketStore = ticketStore;
        this.metrics = metrics;
    }

    /**
     * Statuses persisted by earlier runs, keyed by task id. Tickets that were never
     * touched by a run are absent.
     *
     * @throws TicketStoreException when the store cannot be read
     */
    public Map<String, TaskStatus> loadStatuses(String runId) {
        var statuses = new LinkedHashMap<String, TaskStatus>();
        for (TaskRecord record : ticketStore.getChildTasks(runId)) {
            if (record.status() != null) {
                statuses.put(record.id(), record.status());
            }
        }
        log.info("Loaded {} persisted statuses for run {}", statuses.size(), runId);
        return statuses;
    }

    /**
     * Writes the task's current status. Returns whether the write succeeded; failures are
     * logged and kept for a later retry.
     */
    public synchronized boolean persist(Task task) {
        try {
            ticketStore.updateStatus(task.id(), task.status());
            if (pending.remove(task.id()) != null) {
                log.info("Status of {} re-synchronized as {}", task.id(), task.status());
            }
            return true;
        } catch (RuntimeException e) {
            pending.put(task.id(), task.status());
            metrics.recordPersistFailure();
            log.warn("Failed to persist status {} for task {}: {}", task.status(), task.id(), e.getMessage());
            return false;
        }
    }

    /** Best effort: a failed note is logged and dropped. */
    public void appendNote(String taskId, String text) {
        try {
            ticketStore.appendNote(taskId, text);
        } catch (RuntimeException e) {
            log.warn("Failed to append note to {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Retries every write that failed earlier.
     *
     * @return ids whose status is still not persisted
     */
    public synchronized List<String> retryPending() {
        for (var entry : List.copyOf(pending.entrySet())) {
            try {
                ticketStore.updateStatus(entry.getKey(), entry.getValue());
                pending.remove(entry.getKey());
                log.info("Status of {} re-synchronized as {}", entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                log.warn("Retry of status {} for task {} failed: {}", entry.getValue(), entry.getKey(), e.getMessage());
            }
        }
        return unsyncedTaskIds();
    }

    public synchronized List<String> unsyncedTaskIds() {
        return new ArrayList<>(pending.keySet());
    }

    /** Forgets outstanding writes; called when a new run starts. */
    public synchronized void reset() {
        pending.clear();
    }
}
