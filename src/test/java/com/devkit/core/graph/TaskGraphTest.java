package com.devkit.core.graph;

import com.devkit.core.model.Task;
import com.devkit.core.model.TaskStatus;
import com.devkit.core.persistence.TaskRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    private static TaskRecord record(String id, String... deps) {
        return new TaskRecord(id, "Task " + id, "Do " + id, "Feature", List.of(deps), null);
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("valid graph loads with every task pending")
        void validGraph() {
            var graph = TaskGraph.load(List.of(record("A"), record("B"), record("C", "A", "B"), record("D", "C")));
            assertEquals(4, graph.size());
            assertTrue(graph.tasks().stream().allMatch(t -> t.status() == TaskStatus.PENDING));
            assertEquals(List.of("A", "B", "C", "D"), ids(graph.tasks()));
        }

        @Test
        @DisplayName("cycle A->B->C->A is rejected with the cycle members")
        void cycleRejected() {
            var e = assertThrows(CycleException.class,
                    () -> TaskGraph.load(List.of(record("A", "C"), record("B", "A"), record("C", "B"), record("D"))));
            assertEquals(List.of("A", "B", "C"), e.getTaskIds());
        }

        @Test
        @DisplayName("self dependency is a cycle")
        void selfCycle() {
            var e = assertThrows(CycleException.class, () -> TaskGraph.load(List.of(record("A", "A"))));
            assertEquals(List.of("A"), e.getTaskIds());
        }

        @Test
        @DisplayName("dependency on an unknown task is rejected")
        void danglingReference() {
            var e = assertThrows(DanglingReferenceException.class,
                    () -> TaskGraph.load(List.of(record("A"), record("B", "A", "Z"))));
            assertEquals(Map.of("B", List.of("Z")), e.getMissingByTask());
            assertEquals(List.of("B"), e.getTaskIds());
        }

        @Test
        @DisplayName("duplicate ids are rejected")
        void duplicateIds() {
            var e = assertThrows(GraphValidationException.class,
                    () -> TaskGraph.load(List.of(record("A"), record("A"))));
            assertEquals(List.of("A"), e.getTaskIds());
        }

        @Test
        @DisplayName("missing or unknown label is rejected")
        void badLabel() {
            var e = assertThrows(GraphValidationException.class, () -> TaskGraph.load(List.of(
                    record("A"),
                    new TaskRecord("B", "t", "d", null, List.of(), null),
                    new TaskRecord("C", "t", "d", "Epic", List.of(), null))));
            assertEquals(List.of("B", "C"), e.getTaskIds());
        }

        @Test
        @DisplayName("repeated dependency ids are collapsed")
        void duplicateDependencies() {
            var graph = TaskGraph.load(List.of(record("A"), record("B", "A", "A")));
            assertEquals(List.of("A"), graph.get("B").dependencies());
        }

        @Test
        @DisplayName("empty record list gives an empty graph")
        void emptyGraph() {
            var graph = TaskGraph.load(List.of());
            assertEquals(0, graph.size());
            assertTrue(graph.readyTasks().isEmpty());
        }
    }

    @Nested
    @DisplayName("readyTasks")
    class ReadyTasks {

        @Test
        @DisplayName("returns roots in creation order")
        void rootsInCreationOrder() {
            var graph = TaskGraph.load(List.of(record("B"), record("A"), record("C", "A", "B"), record("D", "C")));
            assertEquals(List.of("B", "A"), ids(graph.readyTasks()));
        }

        @Test
        @DisplayName("is idempotent without intervening updates")
        void idempotent() {
            var graph = TaskGraph.load(List.of(record("A"), record("B"), record("C", "A")));
            assertEquals(ids(graph.readyTasks()), ids(graph.readyTasks()));
        }

        @Test
        @DisplayName("task becomes ready only when all dependencies are completed")
        void waitsForAllDependencies() {
            var graph = TaskGraph.load(List.of(record("A"), record("B"), record("C", "A", "B")));
            graph.update(graph.get("A").withStatus(TaskStatus.COMPLETED));
            assertEquals(List.of("B"), ids(graph.readyTasks()));
            graph.update(graph.get("B").withStatus(TaskStatus.COMPLETED));
            assertEquals(List.of("C"), ids(graph.readyTasks()));
        }

        @Test
        @DisplayName("running and skipped tasks are not ready")
        void nonPendingExcluded() {
            var graph = TaskGraph.load(List.of(record("A"), record("B")));
            graph.update(graph.get("A").withStatus(TaskStatus.RUNNING));
            graph.update(graph.get("B").withStatus(TaskStatus.SKIPPED));
            assertTrue(graph.readyTasks().isEmpty());
        }
    }

    @Nested
    @DisplayName("markBlocked")
    class MarkBlocked {

        @Test
        @DisplayName("blocks the whole dependent chain of a skipped task")
        void transitive() {
            var graph = TaskGraph.load(List.of(record("A"), record("B", "A"), record("C", "B"), record("D")));
            graph.update(graph.get("A").withStatus(TaskStatus.SKIPPED));

            var blocked = graph.markBlocked();

            assertEquals(List.of("B", "C"), ids(blocked));
            assertEquals(TaskStatus.BLOCKED, graph.get("C").status());
            assertEquals("blocked by A (SKIPPED)", graph.get("B").reason());
            assertEquals("blocked by B (BLOCKED)", graph.get("C").reason());
            assertEquals(TaskStatus.PENDING, graph.get("D").status());
        }

        @Test
        @DisplayName("dependents declared before their blocker are still blocked")
        void declaredBeforeBlocker() {
            var graph = TaskGraph.load(List.of(record("C", "B"), record("B", "A"), record("A")));
            graph.update(graph.get("A").withStatus(TaskStatus.SKIPPED));

            assertEquals(List.of("C", "B"), ids(graph.markBlocked()));
        }

        @Test
        @DisplayName("second call blocks nothing new")
        void idempotent() {
            var graph = TaskGraph.load(List.of(record("A"), record("B", "A")));
            graph.update(graph.get("A").withStatus(TaskStatus.SKIPPED));
            graph.markBlocked();
            assertTrue(graph.markBlocked().isEmpty());
        }
    }

    @Nested
    @DisplayName("seed")
    class Seed {

        @Test
        @DisplayName("keeps completed tasks and requeues everything else")
        void seedsPersistedStatuses() {
            var graph = TaskGraph.load(List.of(record("A"), record("B"), record("C", "A", "B"), record("D", "C")));

            var requeued = graph.seed(Map.of(
                    "A", TaskStatus.COMPLETED,
                    "B", TaskStatus.COMPLETED,
                    "C", TaskStatus.RUNNING,
                    "D", TaskStatus.BLOCKED));

            assertEquals(List.of("C", "D"), requeued);
            assertEquals(TaskStatus.COMPLETED, graph.get("A").status());
            assertEquals(TaskStatus.PENDING, graph.get("C").status());
            assertEquals(0, graph.get("C").retryCount());
            assertEquals(List.of("C"), ids(graph.readyTasks()));
        }

        @Test
        @DisplayName("pending and unknown statuses change nothing")
        void pendingUnchanged() {
            var graph = TaskGraph.load(List.of(record("A")));
            assertTrue(graph.seed(Map.of("A", TaskStatus.PENDING, "Z", TaskStatus.COMPLETED)).isEmpty());
            assertEquals(TaskStatus.PENDING, graph.get("A").status());
        }
    }

    @Test
    @DisplayName("update and get reject ids outside the graph")
    void unknownIds() {
        var graph = TaskGraph.load(List.of(record("A")));
        assertThrows(IllegalArgumentException.class, () -> graph.get("Z"));
        var stranger = TaskGraph.load(List.of(record("Z"))).get("Z");
        assertThrows(IllegalArgumentException.class, () -> graph.update(stranger));
    }
}
