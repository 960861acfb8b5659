package com.devkit.gate;

import com.devkit.core.graph.TaskGraph;
import com.devkit.core.model.ExecutionResult;
import com.devkit.core.model.TaskStatus;
import com.devkit.core.persistence.TaskRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewGateTest {

    @Mock
    private JudgmentService judgmentService;

    private static TaskGraph graph() {
        return TaskGraph.load(List.of(
                new TaskRecord("A", "Parser", "Parse CSV", "Feature", List.of(), null),
                new TaskRecord("B", "Exporter", "Export CSV", "Feature", List.of("A"), null)));
    }

    @Nested
    @DisplayName("per task")
    class PerTask {

        @Test
        @DisplayName("passes the change and the task intent to the judgment service")
        void evaluatesTask() {
            var task = graph().get("A");
            when(judgmentService.evaluate(eq("diff of A"), anyString())).thenReturn(new Judgment(true, "Score 8/10"));

            var verdict = new ReviewGate(judgmentService, true).runPerTask(task, ExecutionResult.success("diff of A"));

            assertTrue(verdict.passed());
            assertEquals("Score 8/10", verdict.detail());
            var context = ArgumentCaptor.forClass(String.class);
            verify(judgmentService).evaluate(eq("diff of A"), context.capture());
            assertTrue(context.getValue().startsWith("Task A [FEATURE]: Parser"));
            assertTrue(context.getValue().contains("Parse CSV"));
        }

        @Test
        @DisplayName("disabled per-task review approves without calling the service")
        void disabled() {
            var verdict = new ReviewGate(judgmentService, false)
                    .runPerTask(graph().get("A"), ExecutionResult.success("x"));

            assertTrue(verdict.passed());
            verifyNoInteractions(judgmentService);
        }

        @Test
        @DisplayName("judgment service error is a rejection")
        void errorIsRejection() {
            when(judgmentService.evaluate(anyString(), anyString())).thenThrow(new IllegalStateException("rate limited"));

            var verdict = new ReviewGate(judgmentService, true).runPerTask(graph().get("A"), ExecutionResult.success("x"));

            assertFalse(verdict.passed());
            assertEquals("review error: rate limited", verdict.detail());
        }
    }

    @Nested
    @DisplayName("final")
    class Final {

        @Test
        @DisplayName("nothing completed means nothing to review")
        void nothingCompleted() {
            var verdict = new ReviewGate(judgmentService, true).runFinal(graph(), "");

            assertTrue(verdict.passed());
            assertEquals("nothing to review", verdict.detail());
            verifyNoInteractions(judgmentService);
        }

        @Test
        @DisplayName("lists completed tasks and reviews the cumulative change")
        void reviewsCompletedTasks() {
            var graph = graph();
            graph.update(graph.get("A").withStatus(TaskStatus.COMPLETED));
            graph.update(graph.get("B").withStatus(TaskStatus.COMPLETED));
            when(judgmentService.evaluate(eq("2 files changed"), anyString()))
                    .thenReturn(new Judgment(false, "B duplicates the tokenizer of A"));

            var verdict = new ReviewGate(judgmentService, false).runFinal(graph, "2 files changed");

            assertFalse(verdict.passed());
            var context = ArgumentCaptor.forClass(String.class);
            verify(judgmentService).evaluate(eq("2 files changed"), context.capture());
            assertTrue(context.getValue().contains("- A [FEATURE]: Parser"));
            assertTrue(context.getValue().contains("- B [FEATURE]: Exporter"));
        }
    }
}
