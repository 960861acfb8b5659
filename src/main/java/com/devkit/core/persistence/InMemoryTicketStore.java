package com.devkit.core.persistence;

import com.devkit.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local ticket store. State is lost on exit; intended for tests and dry runs.
 */
public class InMemoryTicketStore implements TicketStore {

    private final Map<String, List<String>> childrenByParent = new ConcurrentHashMap<>();
    private final Map<String, String> contextByParent = new ConcurrentHashMap<>();
    private final Map<String, TaskRecord> records = new ConcurrentHashMap<>();
    private final Map<String, List<String>> notes = new ConcurrentHashMap<>();

    /** Registers (or replaces) the children of a parent ticket. */
    public synchronized void register(String parentId, String context, List<TaskRecord> children) {
        var ids = new ArrayList<String>();
        for (TaskRecord child : children) {
            records.put(child.id(), child);
            ids.add(child.id());
        }
        childrenByParent.put(parentId, ids);
        contextByParent.put(parentId, context == null ? "" : context);
    }

    @Override
    public synchronized List<TaskRecord> getChildTasks(String parentId) {
        return childrenByParent.getOrDefault(parentId, List.of()).stream()
                .map(records::get)
                .toList();
    }

    @Override
    public synchronized void updateStatus(String taskId, TaskStatus status) {
        TaskRecord record = records.get(taskId);
        if (record == null) {
            throw new TicketStoreException("Unknown ticket: " + taskId);
        }
        records.put(taskId, record.withStatus(status));
    }

    @Override
    public void appendNote(String taskId, String text) {
        if (!records.containsKey(taskId)) {
            throw new TicketStoreException("Unknown ticket: " + taskId);
        }
        notes.computeIfAbsent(taskId, k -> new ArrayList<>()).add(text);
    }

    @Override
    public String getParentContext(String parentId) {
        return contextByParent.getOrDefault(parentId, "");
    }

    public synchronized List<String> getNotes(String taskId) {
        return List.copyOf(notes.getOrDefault(taskId, List.of()));
    }

    public synchronized Map<String, TaskStatus> statuses() {
        var result = new LinkedHashMap<String, TaskStatus>();
        records.forEach((id, r) -> result.put(id, r.status()));
        return result;
    }
}
