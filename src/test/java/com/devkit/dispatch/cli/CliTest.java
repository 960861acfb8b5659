package com.devkit.dispatch.cli;

import com.devkit.core.engine.RunEngine;
import com.devkit.core.engine.RunRequest;
import com.devkit.core.events.EventBus;
import com.devkit.core.graph.CycleException;
import com.devkit.core.graph.TaskGraph;
import com.devkit.core.health.HealthCheckService;
import com.devkit.core.health.HealthStatus;
import com.devkit.core.model.ReleaseMode;
import com.devkit.core.model.ReviewVerdict;
import com.devkit.core.model.RunSummary;
import com.devkit.core.model.TaskOutcome;
import com.devkit.core.model.TaskStatus;
import com.devkit.core.persistence.TaskRecord;
import com.devkit.core.persistence.TicketStoreException;
import com.devkit.workspace.WorkspaceAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the devkit CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, output and exit codes.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private RunEngine engine;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        engine = mock(RunEngine.class);
        healthCheckService = mock(HealthCheckService.class);
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        var eventBus = new EventBus();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine, eventBus);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(engine);
                }
                if (cls == AbortCommand.class) {
                    return (K) new AbortCommand(engine);
                }
                if (cls == ReleaseCommand.class) {
                    return (K) new ReleaseCommand(engine);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new DevkitCommand(), createFactory())
                    .setCaseInsensitiveEnumValuesAllowed(true);
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static RunSummary summary(ReviewVerdict review, TaskOutcome... outcomes) {
        return new RunSummary("PROJ-1", List.of(outcomes), List.of(), review, false, false);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            var result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "status", "abort", "release", "health")) {
                assertTrue(result.output().contains(sub), "help should mention " + sub);
            }
        }

        @Test
        @DisplayName("no arguments prints usage")
        void noArguments() {
            var result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: devkit"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("successful run exits 0 and prints the summary")
        void success() {
            when(engine.execute(any(RunRequest.class))).thenReturn(summary(ReviewVerdict.approve("Score 9/10"),
                    new TaskOutcome("PROJ-2", "Parser", TaskStatus.COMPLETED, 1, null)));

            var result = execute("run", "PROJ-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PROJ-2"));
            assertTrue(result.output().contains("All tasks completed."));
        }

        @Test
        @DisplayName("incomplete run exits 1 and shows skip and block reasons")
        void incomplete() {
            when(engine.execute(any(RunRequest.class))).thenReturn(summary(ReviewVerdict.approve("ok"),
                    new TaskOutcome("PROJ-2", "Parser", TaskStatus.COMPLETED, 1, null),
                    new TaskOutcome("PROJ-3", "Exporter", TaskStatus.SKIPPED, 3,
                            "skipped after 3 failed attempts; last: verification failed at 'test'"),
                    new TaskOutcome("PROJ-4", "Docs", TaskStatus.BLOCKED, 0, "blocked by PROJ-3 (SKIPPED)")));

            var result = execute("run", "PROJ-1");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("skipped after 3 failed attempts"));
            assertTrue(result.output().contains("blocked by PROJ-3 (SKIPPED)"));
            assertTrue(result.output().contains("Run incomplete"));
        }

        @Test
        @DisplayName("options are passed through to the engine")
        void options() {
            when(engine.execute(any(RunRequest.class))).thenReturn(summary(null));

            execute("run", "PROJ-1", "--integrate", "--discard-on-abort", "--max-retries", "5");

            var request = ArgumentCaptor.forClass(RunRequest.class);
            verify(engine).execute(request.capture());
            assertEquals(new RunRequest("PROJ-1", true, true, 5), request.getValue());
        }

        @Test
        @DisplayName("invalid task graph exits 2 naming the offending tasks")
        void invalidGraph() {
            when(engine.execute(any(RunRequest.class))).thenThrow(new CycleException(List.of("A", "B")));

            var result = execute("run", "PROJ-1");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Invalid task graph"));
            assertTrue(result.output().contains("[A, B]"));
        }

        @Test
        @DisplayName("workspace and ticket store failures exit 2")
        void fatalErrors() {
            when(engine.execute(any(RunRequest.class)))
                    .thenThrow(new WorkspaceAcquisitionException("worktree is corrupted"))
                    .thenThrow(new TicketStoreException("No ticket document for parent PROJ-1"));

            var workspace = execute("run", "PROJ-1");
            var store = execute("run", "PROJ-1");

            assertEquals(2, workspace.exitCode());
            assertTrue(workspace.output().contains("worktree is corrupted"));
            assertEquals(2, store.exitCode());
            assertTrue(store.output().contains("No ticket document"));
        }

        @Test
        @DisplayName("max-retries below 1 is rejected before running")
        void badMaxRetries() {
            var result = execute("run", "PROJ-1", "--max-retries", "0");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("root cause message is extracted from nested exceptions")
        void rootCause() {
            var e = new RuntimeException("outer", new IllegalStateException("inner"));
            assertEquals("inner", RunCommand.rootCauseMessage(e));
        }
    }

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("shows each task with ready tasks marked READY")
        void showsTasks() {
            var graph = TaskGraph.load(List.of(
                    new TaskRecord("PROJ-2", "Parser", "", "Feature", List.of(), TaskStatus.COMPLETED),
                    new TaskRecord("PROJ-3", "Exporter", "", "Feature", List.of("PROJ-2"), null),
                    new TaskRecord("PROJ-4", "Docs", "", "Chore", List.of("PROJ-3"), null)));
            graph.seed(Map.of("PROJ-2", TaskStatus.COMPLETED));
            when(engine.plan("PROJ-1")).thenReturn(graph);

            var result = execute("status", "PROJ-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("READY"));
            assertTrue(result.output().contains("PROJ-4"));
            assertTrue(result.output().contains("1/3 completed, 1 ready"));
        }

        @Test
        @DisplayName("invalid graph exits 2")
        void invalidGraph() {
            when(engine.plan("PROJ-1")).thenThrow(new CycleException(List.of("A")));

            assertEquals(2, execute("status", "PROJ-1").exitCode());
        }
    }

    @Nested
    @DisplayName("abort and release")
    class AbortReleaseTests {

        @Test
        @DisplayName("abort creates the abort marker")
        void abort() throws Exception {
            when(engine.requestAbort("PROJ-1")).thenReturn(Path.of(".devkit/abort/PROJ-1"));

            var result = execute("abort", "PROJ-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Abort requested for PROJ-1"));
        }

        @Test
        @DisplayName("release accepts lower-case modes")
        void release() {
            when(engine.release("PROJ-1", ReleaseMode.DISCARD)).thenReturn(true);

            var result = execute("release", "PROJ-1", "--mode", "discard");

            assertEquals(0, result.exitCode());
            verify(engine).release("PROJ-1", ReleaseMode.DISCARD);
        }

        @Test
        @DisplayName("release of an unknown run exits 1")
        void releaseUnknown() {
            when(engine.release("PROJ-9", ReleaseMode.INTEGRATE)).thenReturn(false);

            var result = execute("release", "PROJ-9", "--mode", "INTEGRATE");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No workspace found for PROJ-9"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("all components up exits 0")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("git", HealthStatus.Status.UP, "git available"),
                    new HealthStatus("ticket store", HealthStatus.Status.UP, "file store reachable")));

            var result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ready to run"));
        }

        @Test
        @DisplayName("a component down exits 1")
        void oneDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("git", HealthStatus.Status.UP, "git available"),
                    new HealthStatus("check runner", HealthStatus.Status.DOWN, "just not found on PATH")));

            var result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("just not found on PATH"));
        }
    }
}
