package com.devkit.core.graph;

import com.devkit.core.model.Task;
import com.devkit.core.model.TaskLabel;
import com.devkit.core.model.TaskStatus;
import com.devkit.core.persistence.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The tasks of one run and their dependency edges.
 * <p>
 * A graph is only ever built through {@link #load(List)}, which guarantees that every
 * dependency refers to a task of the same graph and that the dependency relation is
 * acyclic. Iteration order is always creation order (the order of the loaded records).
 * <p>
 * Not thread-safe: the scheduler is the sole writer.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final LinkedHashMap<String, Task> tasks;

    private TaskGraph(LinkedHashMap<String, Task> tasks) {
        this.tasks = tasks;
    }

    /**
     * Validates raw ticket records and builds a graph with every task {@link TaskStatus#PENDING}.
     *
     * @throws GraphValidationException    on duplicate ids or a missing/unknown label
     * @throws DanglingReferenceException  when a dependency names a task outside the graph
     * @throws CycleException              when the dependencies contain a cycle
     */
    public static TaskGraph load(List<TaskRecord> records) {
        var tasks = new LinkedHashMap<String, Task>();
        var duplicates = new LinkedHashSet<String>();
        var badLabels = new ArrayList<String>();

        for (TaskRecord record : records) {
            if (tasks.containsKey(record.id())) {
                duplicates.add(record.id());
                continue;
            }
            TaskLabel label;
            try {
                label = TaskLabel.fromString(record.label());
            } catch (IllegalArgumentException e) {
                badLabels.add(record.id());
                continue;
            }
            tasks.put(record.id(), new Task(record.id(), record.title(), record.description(), label,
                    List.copyOf(new LinkedHashSet<>(record.dependencies())), TaskStatus.PENDING, 0, null));
        }

        if (!duplicates.isEmpty()) {
            throw new GraphValidationException("Duplicate task ids " + duplicates, List.copyOf(duplicates));
        }
        if (!badLabels.isEmpty()) {
            throw new GraphValidationException(
                    "Tasks without a valid label (expected one of " + List.of(TaskLabel.values()) + "): " + badLabels,
                    badLabels);
        }

        checkReferences(tasks);
        checkAcyclic(tasks);

        log.info("Loaded task graph with {} tasks", tasks.size());
        return new TaskGraph(tasks);
    }

    private static void checkReferences(Map<String, Task> tasks) {
        var missing = new LinkedHashMap<String, List<String>>();
        for (Task task : tasks.values()) {
            var unknown = task.dependencies().stream()
                    .filter(dep -> !tasks.containsKey(dep))
                    .toList();
            if (!unknown.isEmpty()) {
                missing.put(task.id(), unknown);
            }
        }
        if (!missing.isEmpty()) {
            throw new DanglingReferenceException(missing);
        }
    }

    /**
     * Kahn's algorithm: repeatedly remove zero-indegree tasks. Whatever is left once
     * no zero-indegree task remains sits on, or behind, a cycle.
     */
    private static void checkAcyclic(Map<String, Task> tasks) {
        var indegree = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        for (Task task : tasks.values()) {
            indegree.put(task.id(), task.dependencies().size());
            for (String dep : task.dependencies()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        indegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        int visited = 0;
        while (!queue.isEmpty()) {
            String id = queue.poll();
            visited++;
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (indegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (visited < tasks.size()) {
            var unvisited = tasks.keySet().stream()
                    .filter(id -> indegree.get(id) > 0)
                    .toList();
            throw new CycleException(unvisited);
        }
    }

    /**
     * Pending tasks whose dependencies are all completed, in creation order.
     * Calling this repeatedly without an intervening status change returns the same list.
     */
    public List<Task> readyTasks() {
        var ready = new ArrayList<Task>();
        for (Task task : tasks.values()) {
            if (task.status() != TaskStatus.PENDING) {
                continue;
            }
            var unsatisfied = task.dependencies().stream()
                    .filter(dep -> tasks.get(dep).status() != TaskStatus.COMPLETED)
                    .toList();
            if (unsatisfied.isEmpty()) {
                ready.add(task);
            } else {
                log.debug("  {} [{}] deps unsatisfied: {}", task.id(), task.label(), unsatisfied);
            }
        }
        return ready;
    }

    /**
     * Relabels every pending task that can no longer become ready as {@link TaskStatus#BLOCKED}.
     * A task is blocked when a dependency is skipped, failed or itself blocked, so blocking
     * propagates down the whole dependent chain.
     *
     * @return the newly blocked tasks, in creation order
     */
    public List<Task> markBlocked() {
        var blocked = new LinkedHashMap<String, Task>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Task task : tasks.values()) {
                if (task.status() != TaskStatus.PENDING) {
                    continue;
                }
                Optional<Task> culprit = task.dependencies().stream()
                        .map(tasks::get)
                        .filter(dep -> dep.status() == TaskStatus.SKIPPED
                                || dep.status() == TaskStatus.FAILED
                                || dep.status() == TaskStatus.BLOCKED)
                        .findFirst();
                if (culprit.isPresent()) {
                    var dep = culprit.get();
                    var updated = task.withStatus(TaskStatus.BLOCKED,
                            "blocked by " + dep.id() + " (" + dep.status() + ")");
                    tasks.put(task.id(), updated);
                    blocked.put(task.id(), updated);
                    changed = true;
                }
            }
        }
        var result = new ArrayList<Task>();
        for (String id : tasks.keySet()) {
            if (blocked.containsKey(id)) {
                result.add(blocked.get(id));
            }
        }
        return result;
    }

    /**
     * Applies statuses persisted by an earlier, interrupted run. Completed tasks stay
     * completed; any other persisted status becomes pending again with a fresh retry
     * budget, because its outcome in the earlier run was either unconfirmed or final
     * only for that run.
     *
     * @return ids of tasks whose persisted status was not kept as-is
     */
    public List<String> seed(Map<String, TaskStatus> persisted) {
        var changed = new ArrayList<String>();
        for (Task task : List.copyOf(tasks.values())) {
            TaskStatus previous = persisted.get(task.id());
            if (previous == null) {
                continue;
            }
            if (previous == TaskStatus.COMPLETED) {
                tasks.put(task.id(), task.withStatus(TaskStatus.COMPLETED, "completed in an earlier run"));
            } else {
                tasks.put(task.id(), task.reset());
                if (previous != TaskStatus.PENDING) {
                    log.info("Task {} was {} in an earlier run, re-queued as PENDING", task.id(), previous);
                    changed.add(task.id());
                }
            }
        }
        return changed;
    }

    /** Replaces the stored task with an updated copy of it. */
    public void update(Task task) {
        if (!tasks.containsKey(task.id())) {
            throw new IllegalArgumentException("Task not in graph: " + task.id());
        }
        tasks.put(task.id(), task);
    }

    public Task get(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Task not in graph: " + taskId);
        }
        return task;
    }

    /** Snapshot of all tasks in creation order. */
    public List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public List<Task> tasksWithStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(t -> t.status() == status)
                .toList();
    }

    public int size() {
        return tasks.size();
    }
}
